package com.example.esrepo.application.port;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 單次 Save 的提交標頭
 * <p>
 * 同一次 Save 內的每筆事件都會附上完全相同的標頭。建立時即帶有 {@value #COMMIT_ID} 與
 * {@value #AGGREGATE_TYPE_NAME}，寫入每筆事件時再加入 {@value #EVENT_TYPE_NAME}。
 * 呼叫端只能新增自訂標頭，保留鍵不可覆寫，也沒有移除操作。
 * </p>
 */
public final class CommitHeaders {

	public static final String COMMIT_ID = "CommitId";
	public static final String AGGREGATE_TYPE_NAME = "AggregateTypeName";
	public static final String EVENT_TYPE_NAME = "EventTypeName";

	private static final Set<String> RESERVED = Set.of(COMMIT_ID, AGGREGATE_TYPE_NAME, EVENT_TYPE_NAME);

	private final Map<String, Object> headers = new LinkedHashMap<>();

	private CommitHeaders(UUID commitId, String aggregateTypeName) {
		headers.put(COMMIT_ID, commitId.toString());
		headers.put(AGGREGATE_TYPE_NAME, aggregateTypeName);
	}

	public static CommitHeaders create(UUID commitId, String aggregateTypeName) {
		if (commitId == null) {
			throw new IllegalArgumentException("commitId 不可為空");
		}
		if (aggregateTypeName == null || aggregateTypeName.isBlank()) {
			throw new IllegalArgumentException("aggregateTypeName 不可為空");
		}
		return new CommitHeaders(commitId, aggregateTypeName);
	}

	/**
	 * 新增自訂標頭
	 *
	 * @throws IllegalArgumentException 鍵為空或為保留鍵
	 */
	public CommitHeaders put(String name, Object value) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("標頭名稱不可為空");
		}
		if (RESERVED.contains(name)) {
			throw new IllegalArgumentException("保留標頭不可覆寫: " + name);
		}
		headers.put(name, value);
		return this;
	}

	public Object get(String name) {
		return headers.get(name);
	}

	public String getCommitId() {
		return (String) headers.get(COMMIT_ID);
	}

	public String getAggregateTypeName() {
		return (String) headers.get(AGGREGATE_TYPE_NAME);
	}

	public static boolean isReserved(String name) {
		return RESERVED.contains(name);
	}

	/**
	 * @return 唯讀檢視，保持加入順序
	 */
	public Map<String, Object> asMap() {
		return Collections.unmodifiableMap(headers);
	}
}
