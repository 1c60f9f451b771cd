package me.golemcore.imbot.domain.bot;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.List;

/**
 * Splits oversized text into pieces that fit a platform limit. Concatenating
 * the pieces always yields the original text.
 */
public final class TextChunker {

    private static final int BREAK_WINDOW_PERCENT = 70;

    private TextChunker() {
    }

    public static List<String> chunk(String text, int limit) {
        if (text == null) {
            return List.of("");
        }
        if (limit <= 0 || text.length() <= limit) {
            return List.of(text);
        }
        List<String> chunks = new ArrayList<>();
        String remaining = text;
        while (remaining.length() > limit) {
            int breakPoint = findBreakPoint(remaining, limit);
            chunks.add(remaining.substring(0, breakPoint));
            remaining = remaining.substring(breakPoint);
        }
        if (!remaining.isEmpty()) {
            chunks.add(remaining);
        }
        return chunks;
    }

    /**
     * Prefers the last newline, then the last space, within the trailing 30%
     * of the window. Falls back to a hard cut that never splits a surrogate
     * pair.
     */
    static int findBreakPoint(String text, int limit) {
        int windowStart = limit * BREAK_WINDOW_PERCENT / 100;
        for (int i = limit - 1; i >= windowStart && i >= 0; i--) {
            if (text.charAt(i) == '\n') {
                return i + 1;
            }
        }
        for (int i = limit - 1; i >= windowStart && i >= 0; i--) {
            if (text.charAt(i) == ' ') {
                return i + 1;
            }
        }
        if (limit > 1 && Character.isHighSurrogate(text.charAt(limit - 1))) {
            return limit - 1;
        }
        return limit;
    }
}
