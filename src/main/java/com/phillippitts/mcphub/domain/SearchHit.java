package com.phillippitts.mcphub.domain;

/**
 * One retrieved chunk.
 *
 * @param source document title or path the chunk came from
 * @param text   chunk text
 * @param score  similarity score, higher is closer
 */
public record SearchHit(String source, String text, double score) {
}
