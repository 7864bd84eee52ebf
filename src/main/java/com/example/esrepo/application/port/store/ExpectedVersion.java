package com.example.esrepo.application.port.store;

/**
 * 寫入時可使用的特殊預期版本值
 */
public final class ExpectedVersion {

	/**
	 * Stream 必須尚不存在
	 */
	public static final long NO_STREAM = -1;

	/**
	 * 不做樂觀鎖檢查
	 */
	public static final long ANY = -2;

	private ExpectedVersion() {
	}
}
