package me.golemcore.runtime.domain.model;

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

/**
 * One task-list line of the heartbeat checklist.
 *
 * @param lineNumber
 *            1-based line number at parse time
 * @param text
 *            item text without the bullet and checkbox
 * @param done
 *            whether the box is checked
 * @param rawLine
 *            the line exactly as read, used to locate the item again when
 *            marking it done
 */
public record ChecklistItem(int lineNumber, String text, boolean done, String rawLine) {
}
