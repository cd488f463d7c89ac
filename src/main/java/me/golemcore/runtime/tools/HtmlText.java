package me.golemcore.runtime.tools;

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

import java.util.regex.Pattern;

/**
 * Turns an HTML page into readable plain text: scripts, styles and markup
 * removed, block elements as line breaks, common entities decoded.
 */
final class HtmlText {

    private static final Pattern INVISIBLE = Pattern.compile("<(script|style|noscript|head)[^>]*>.*?</\\1>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern COMMENTS = Pattern.compile("<!--.*?-->", Pattern.DOTALL);
    private static final Pattern TITLE = Pattern.compile("<title[^>]*>(.*?)</title>",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern BLOCK_TAGS = Pattern.compile("</?(br|p|div|tr|li|h[1-6]|section|article|ul|ol)[^>]*>",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ALL_TAGS = Pattern.compile("<[^>]+>");
    private static final Pattern MULTI_NEWLINES = Pattern.compile("\\n\\s*\\n\\s*\\n+");
    private static final Pattern MULTI_SPACES = Pattern.compile("[ \\t\\x0B\\f\\r]{2,}");

    private HtmlText() {
    }

    static String title(String html) {
        if (html == null) {
            return null;
        }
        var matcher = TITLE.matcher(html);
        return matcher.find() ? decodeEntities(matcher.group(1)).strip() : null;
    }

    static String toText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        String result = COMMENTS.matcher(html).replaceAll("");
        result = INVISIBLE.matcher(result).replaceAll("");
        result = BLOCK_TAGS.matcher(result).replaceAll("\n");
        result = ALL_TAGS.matcher(result).replaceAll("");
        result = decodeEntities(result);
        result = MULTI_SPACES.matcher(result).replaceAll(" ");
        result = MULTI_NEWLINES.matcher(result).replaceAll("\n\n");
        return result.strip();
    }

    private static String decodeEntities(String text) {
        return text
                .replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&apos;", "'")
                .replace("&amp;", "&");
    }
}
