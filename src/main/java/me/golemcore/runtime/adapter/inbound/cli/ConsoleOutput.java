package me.golemcore.runtime.adapter.inbound.cli;

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

import picocli.CommandLine;

import java.io.PrintWriter;

/**
 * ANSI-colored terminal output for the command line.
 */
final class ConsoleOutput {

    private ConsoleOutput() {
    }

    static void info(PrintWriter out, String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [golemcore]|@ " + message));
        out.flush();
    }

    static void success(PrintWriter out, String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
        out.flush();
    }

    static void error(PrintWriter err, String message) {
        err.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
        err.flush();
    }
}
