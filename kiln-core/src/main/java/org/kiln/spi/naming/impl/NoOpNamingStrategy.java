package org.kiln.spi.naming.impl;

import org.kiln.spi.naming.NamingStrategy;

/**
 * 변환 없이 입력 그대로 반환하는 기본 네이밍 전략
 * <p>
 * 예시: 엔티티 "User" → 테이블 "User", 필드 "createdAt" → 컬럼 "createdAt"
 */
public class NoOpNamingStrategy implements NamingStrategy {

    @Override
    public String toPhysicalColumnName(String logicalName) {
        return logicalName;
    }

    @Override
    public String toPhysicalTableName(String logicalName) {
        return logicalName;
    }
}
