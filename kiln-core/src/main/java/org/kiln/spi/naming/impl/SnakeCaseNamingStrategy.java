package org.kiln.spi.naming.impl;

import org.kiln.spi.naming.NamingStrategy;

/**
 * 카멜케이스를 스네이크케이스로 변환하는 네이밍 전략
 * <p>
 * 변환 예시:
 * <ul>
 *   <li>필드명 "createdAt" → 컬럼명 "created_at"</li>
 *   <li>필드명 "HTTPStatus" → 컬럼명 "http_status"</li>
 *   <li>엔티티명 "BlogPost" → 테이블명 "blog_post"</li>
 * </ul>
 */
public class SnakeCaseNamingStrategy implements NamingStrategy {

    @Override
    public String toPhysicalColumnName(String logicalName) {
        return toSnakeCase(logicalName);
    }

    @Override
    public String toPhysicalTableName(String logicalName) {
        return toSnakeCase(logicalName);
    }

    /**
     * 변환 규칙:
     * <ul>
     *   <li>"maxLevel" → "max_level"</li>
     *   <li>"HTTPServer" → "http_server"</li>
     *   <li>"get2HTTPResponse" → "get2_http_response"</li>
     * </ul>
     */
    private String toSnakeCase(String camelCase) {
        if (camelCase == null || camelCase.isEmpty()) {
            return camelCase;
        }

        StringBuilder result = new StringBuilder();
        char[] chars = camelCase.toCharArray();

        for (int i = 0; i < chars.length; i++) {
            char current = chars[i];

            if (Character.isUpperCase(current)) {
                if (i > 0 && shouldInsertUnderscore(chars, i)) {
                    result.append('_');
                }
                result.append(Character.toLowerCase(current));
            } else {
                result.append(current);
            }
        }

        return result.toString();
    }

    /**
     * 이전 문자가 소문자/숫자이거나, 연속 대문자의 마지막(다음 문자가 소문자)인 경우 언더스코어 삽입
     */
    private boolean shouldInsertUnderscore(char[] chars, int index) {
        char prev = chars[index - 1];

        if (Character.isLowerCase(prev) || Character.isDigit(prev)) {
            return true;
        }

        // "HTTPServer" → "HTTP" + "_" + "Server"
        if (Character.isUpperCase(prev) && index < chars.length - 1) {
            return Character.isLowerCase(chars[index + 1]);
        }

        return false;
    }
}
