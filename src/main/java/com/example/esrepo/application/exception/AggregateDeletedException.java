package com.example.esrepo.application.exception;

import lombok.Getter;

/**
 * 事件儲存端回報 Stream 已被刪除 (tombstoned)
 */
@Getter
public class AggregateDeletedException extends EventRepositoryException {

	private static final long serialVersionUID = 1L;

	private final String streamName;

	public AggregateDeletedException(String streamName) {
		super("Stream 已被刪除: " + streamName);
		this.streamName = streamName;
	}

	public AggregateDeletedException(String streamName, Throwable cause) {
		super("Stream 已被刪除: " + streamName, cause);
		this.streamName = streamName;
	}
}
