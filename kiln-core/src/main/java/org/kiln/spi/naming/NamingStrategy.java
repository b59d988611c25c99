package org.kiln.spi.naming;

import java.util.Locale;

/**
 * Kiln의 네이밍 전략 인터페이스
 * <p>
 * 논리적 이름(엔티티명, 필드명)을 물리적 이름(테이블명, 컬럼명)으로 변환합니다.
 * 스키마 정의에서 {@code table:} 을 명시하면 전략보다 우선합니다.
 *
 * @see org.kiln.spi.naming.impl.NoOpNamingStrategy
 * @see org.kiln.spi.naming.impl.SnakeCaseNamingStrategy
 */
public interface NamingStrategy {

    /**
     * @param logicalName 필드명 (예: "createdAt")
     * @return 물리적 컬럼명 (예: "created_at")
     */
    String toPhysicalColumnName(String logicalName);

    /**
     * @param logicalName 엔티티명 (예: "BlogPost")
     * @return 물리적 테이블명 (예: "blog_post")
     */
    String toPhysicalTableName(String logicalName);

    /**
     * Resolves a strategy from its configuration keyword ({@code none}, {@code snake_case}).
     *
     * @throws IllegalArgumentException for unknown keywords
     */
    static NamingStrategy fromKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return new org.kiln.spi.naming.impl.NoOpNamingStrategy();
        }
        return switch (keyword.trim().toLowerCase(Locale.ROOT)) {
            case "none", "noop" -> new org.kiln.spi.naming.impl.NoOpNamingStrategy();
            case "snake_case", "snake" -> new org.kiln.spi.naming.impl.SnakeCaseNamingStrategy();
            default -> throw new IllegalArgumentException("Unknown naming strategy: " + keyword);
        };
    }
}
