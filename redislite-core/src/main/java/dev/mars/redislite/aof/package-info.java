/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
 */
/**
 * Append-only command log (AOF).
 * <p>
 * This package provides the durability layer of the key-value server:
 * <ul>
 *   <li>{@link dev.mars.redislite.aof.AppendOnlyLog} - The log interface</li>
 *   <li>{@link dev.mars.redislite.aof.FileAppendOnlyLog} - File-based implementation</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Log-before-reply:</b> A successful command is appended before its response is written</li>
 *   <li><b>Errors are not logged:</b> The log holds only commands that succeeded</li>
 *   <li><b>Strict replay:</b> The whole log is re-executed on startup; corruption is fatal</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * *3\r\n$3\r\nset\r\n$1\r\nk\r\n$1\r\nv\r\n     // record 1
 * *2\r\n$3\r\ndel\r\n$1\r\nk\r\n                // record 2
 * </pre>
 *
 * @see dev.mars.redislite.aof.AppendOnlyLog
 */
package dev.mars.redislite.aof;
