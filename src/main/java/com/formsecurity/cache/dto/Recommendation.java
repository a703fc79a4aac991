package com.formsecurity.cache.dto;

/**
 * 维护 / 自检建议
 *
 * @param type     建议类别，如 cleanup、vacuum、performance、reliability
 * @param priority high | medium | low | info
 */
public record Recommendation(String type, String priority, String message) {
}
