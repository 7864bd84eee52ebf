package com.example.esrepo.application.exception;

import lombok.Getter;

/**
 * 單次寫入的資料量超過儲存端上限 (EventStoreDB 的 {@code MaxAppendSize}，預設 1 MiB)
 * <p>
 * 整批事件未寫入。需調高儲存端上限，或減少單次 Save 的事件數。
 * </p>
 */
@Getter
public class AppendSizeExceededException extends EventRepositoryException {

	private static final long serialVersionUID = 1L;

	private final String streamName;

	public AppendSizeExceededException(String streamName, Throwable cause) {
		super("Stream " + streamName + " 單次寫入超過儲存端大小上限", cause);
		this.streamName = streamName;
	}
}
