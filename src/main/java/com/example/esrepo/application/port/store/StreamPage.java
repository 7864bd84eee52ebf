package com.example.esrepo.application.port.store;

import java.util.List;

/**
 * 單次順向讀取的結果頁
 *
 * @param events       依序號排列的事件
 * @param nextPosition 下一頁應從哪個序號開始
 * @param endOfStream  是否已讀到 Stream 結尾
 */
public record StreamPage(List<RecordedEnvelope> events, long nextPosition, boolean endOfStream) {
}
