package com.example.esrepo.infra.event.naming;

import java.util.UUID;

/**
 * 預設命名規則：{型別名稱首字小寫}-{id}
 * <p>
 * 例：{@code BankAccount} + {@code 3f2c...} → {@code bankAccount-3f2c...}
 * </p>
 */
public class CamelCaseStreamNameStrategy implements StreamNameStrategy {

	private static final String SEPARATOR = "-";

	@Override
	public String streamNameFor(Class<?> aggregateType, UUID aggregateId) {
		String typeName = aggregateType.getSimpleName();
		if (typeName.isEmpty()) {
			throw new IllegalArgumentException("匿名類別無法產生 Stream 名稱: " + aggregateType.getName());
		}
		return Character.toLowerCase(typeName.charAt(0)) + typeName.substring(1) + SEPARATOR + aggregateId;
	}
}
