package com.voltquery.service.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits answer text into short chunks for streaming, preferring word boundaries.
 * The same text always yields the same chunks.
 */
final class AnswerChunker {

    static final int CHUNK_SIZE = 24;

    // how far past the nominal end to look for whitespace
    private static final int BOUNDARY_LOOKAHEAD = 8;

    private AnswerChunker() {
    }

    static List<String> split(String text) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return chunks;
        }

        int pos = 0;
        while (pos < text.length()) {
            int end = Math.min(pos + CHUNK_SIZE, text.length());
            if (end < text.length()) {
                for (int i = end; i < Math.min(end + BOUNDARY_LOOKAHEAD, text.length()); i++) {
                    if (Character.isWhitespace(text.charAt(i))) {
                        end = i + 1;
                        break;
                    }
                }
            }
            chunks.add(text.substring(pos, end));
            pos = end;
        }
        return chunks;
    }
}
