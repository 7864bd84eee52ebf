package com.example.esrepo.application.exception;

/**
 * 事件倉儲相關錯誤的共同父類別
 * <p>
 * 一律為 unchecked，呼叫端依子類別決定是否重新載入並重試。
 * </p>
 */
public class EventRepositoryException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public EventRepositoryException(String message) {
		super(message);
	}

	public EventRepositoryException(String message, Throwable cause) {
		super(message, cause);
	}
}
