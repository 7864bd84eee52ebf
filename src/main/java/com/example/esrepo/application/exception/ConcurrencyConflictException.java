package com.example.esrepo.application.exception;

import lombok.Getter;

/**
 * 樂觀鎖衝突：寫入時的預期版本與 Stream 目前版本不一致
 * <p>
 * 倉儲不會自動重試，呼叫端應重新載入聚合根後再決定是否重送。
 * </p>
 */
@Getter
public class ConcurrencyConflictException extends EventRepositoryException {

	private static final long serialVersionUID = 1L;

	private final String streamName;
	private final long expectedVersion;

	public ConcurrencyConflictException(String streamName, long expectedVersion, String message) {
		super(message);
		this.streamName = streamName;
		this.expectedVersion = expectedVersion;
	}

	public ConcurrencyConflictException(String streamName, long expectedVersion, String message, Throwable cause) {
		super(message, cause);
		this.streamName = streamName;
		this.expectedVersion = expectedVersion;
	}
}
