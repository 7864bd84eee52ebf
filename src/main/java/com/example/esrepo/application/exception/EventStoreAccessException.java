package com.example.esrepo.application.exception;

/**
 * 其他無法分類的儲存端 / 傳輸層失敗
 */
public class EventStoreAccessException extends EventRepositoryException {

	private static final long serialVersionUID = 1L;

	public EventStoreAccessException(String message, Throwable cause) {
		super(message, cause);
	}
}
