package com.example.esrepo.application.exception;

/**
 * 執行緒在分頁讀取或分頁寫入之間被中斷
 * <p>
 * 寫入路徑若在 commit 前被中斷，交易會被放棄，讀者看不到任何變化。
 * </p>
 */
public class RepositoryOperationCancelledException extends EventRepositoryException {

	private static final long serialVersionUID = 1L;

	public RepositoryOperationCancelledException(String message) {
		super(message);
	}

	public RepositoryOperationCancelledException(String message, Throwable cause) {
		super(message, cause);
	}
}
