package com.example.esrepo.application.exception;

import lombok.Getter;

/**
 * 事件儲存端回報 Stream 不存在
 */
@Getter
public class AggregateNotFoundException extends EventRepositoryException {

	private static final long serialVersionUID = 1L;

	private final String streamName;

	public AggregateNotFoundException(String streamName) {
		super("Stream 不存在: " + streamName);
		this.streamName = streamName;
	}

	public AggregateNotFoundException(String streamName, Throwable cause) {
		super("Stream 不存在: " + streamName, cause);
		this.streamName = streamName;
	}
}
