package com.example.esrepo.application.exception;

import lombok.Getter;

/**
 * 指定的目標版本超出 Stream 實際長度
 */
@Getter
public class VersionNotFoundException extends EventRepositoryException {

	private static final long serialVersionUID = 1L;

	private final String streamName;
	private final long requestedVersion;
	private final long availableVersion;

	public VersionNotFoundException(String streamName, long requestedVersion, long availableVersion) {
		super("Stream " + streamName + " 僅有 " + availableVersion + " 筆事件，無法重建至版本 " + requestedVersion);
		this.streamName = streamName;
		this.requestedVersion = requestedVersion;
		this.availableVersion = availableVersion;
	}
}
