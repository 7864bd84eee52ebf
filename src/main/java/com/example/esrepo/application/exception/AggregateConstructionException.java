package com.example.esrepo.application.exception;

/**
 * 聚合根型別無法建立空白實例 (未註冊重播建構子，或建構失敗)，屬於配置層級錯誤
 */
public class AggregateConstructionException extends EventRepositoryException {

	private static final long serialVersionUID = 1L;

	public AggregateConstructionException(String message) {
		super(message);
	}

	public AggregateConstructionException(String message, Throwable cause) {
		super(message, cause);
	}
}
