package com.example.esrepo.application.port.store;

import java.util.List;

/**
 * 以 Stream 與預期版本為範圍的寫入交易
 * <p>
 * {@link #commit()} 之前寫入的分頁對讀者不可見；放棄交易後亦不留下任何痕跡。
 * </p>
 */
public interface StreamTransaction {

	void write(List<EventEnvelope> envelopes);

	/**
	 * 一次性提交所有已寫入的分頁，預期版本不符時拋出
	 * {@link com.example.esrepo.application.exception.ConcurrencyConflictException}
	 */
	void commit();

	/**
	 * 放棄交易，未提交前呼叫才有效果
	 */
	void rollback();
}
