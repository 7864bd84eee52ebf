package com.example.esrepo.application.port;

/**
 * Save 前擴充提交標頭的唯一切入點
 * <p>
 * 只能透過 {@link CommitHeaders#put(String, Object)} 新增標頭；保留標頭必須維持原值。
 * </p>
 */
@FunctionalInterface
public interface CommitHeadersCustomizer {

	CommitHeadersCustomizer NONE = headers -> {
	};

	void customize(CommitHeaders headers);
}
