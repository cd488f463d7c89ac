package me.golemcore.runtime.domain.service;

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

import me.golemcore.runtime.domain.model.ChecklistItem;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and updates markdown task lists ({@code - [ ] text},
 * {@code * [x] text}). Lines that are not task items are left untouched.
 */
public final class ChecklistParser {

    private static final Pattern LINE_SEPARATOR = Pattern.compile("\\R");
    private static final Pattern ITEM = Pattern.compile("^(\\s*[-*]\\s+\\[)([ xX])(\\]\\s+)(.*?)\\s*$");

    private ChecklistParser() {
    }

    public static List<ChecklistItem> parse(String content) {
        List<ChecklistItem> items = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return items;
        }
        String[] lines = content.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            Matcher matcher = ITEM.matcher(lines[i]);
            if (matcher.matches() && !matcher.group(4).isBlank()) {
                boolean done = !" ".equals(matcher.group(2));
                items.add(new ChecklistItem(i + 1, matcher.group(4), done, lines[i]));
            }
        }
        return items;
    }

    /**
     * Check off {@code item} in {@code content}. The item is found by its
     * original line text, so edits elsewhere in the file since it was parsed
     * do not matter.
     *
     * @return the updated content, or the same instance when the line is gone
     *         or already checked
     */
    public static String markDone(String content, ChecklistItem item) {
        if (content == null) {
            return null;
        }
        List<int[]> spans = lineSpans(content);
        int target = -1;
        int hint = item.lineNumber() - 1;
        if (hint >= 0 && hint < spans.size() && lineAt(content, spans.get(hint)).equals(item.rawLine())) {
            target = hint;
        } else {
            for (int i = 0; i < spans.size(); i++) {
                if (lineAt(content, spans.get(i)).equals(item.rawLine())) {
                    target = i;
                    break;
                }
            }
        }
        if (target < 0) {
            return content;
        }
        int lineStart = spans.get(target)[0];
        Matcher matcher = ITEM.matcher(lineAt(content, spans.get(target)));
        if (!matcher.matches() || !" ".equals(matcher.group(2))) {
            return content;
        }
        // only the box character changes; line separators stay as written
        int box = lineStart + matcher.start(2);
        return content.substring(0, box) + "x" + content.substring(box + 1);
    }

    private static List<int[]> lineSpans(String content) {
        List<int[]> spans = new ArrayList<>();
        Matcher separator = LINE_SEPARATOR.matcher(content);
        int start = 0;
        while (separator.find()) {
            spans.add(new int[] { start, separator.start() });
            start = separator.end();
        }
        spans.add(new int[] { start, content.length() });
        return spans;
    }

    private static String lineAt(String content, int[] span) {
        return content.substring(span[0], span[1]);
    }
}
