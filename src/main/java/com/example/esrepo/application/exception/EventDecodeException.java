package com.example.esrepo.application.exception;

/**
 * 事件信封 (payload + metadata) 無法還原為 Domain Event
 * <p>
 * 屬於致命錯誤，不重試。可能原因：型別標籤缺失、未註冊，或 JSON 結構損毀。
 * </p>
 */
public class EventDecodeException extends EventRepositoryException {

	private static final long serialVersionUID = 1L;

	public EventDecodeException(String message) {
		super(message);
	}

	public EventDecodeException(String message, Throwable cause) {
		super(message, cause);
	}
}
