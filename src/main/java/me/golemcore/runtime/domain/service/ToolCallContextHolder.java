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

import me.golemcore.runtime.domain.model.ToolCallContext;

/**
 * ThreadLocal holder for the {@link ToolCallContext} of the call being
 * dispatched. Set by {@link ToolDispatchService} around
 * {@code ToolComponent.execute}; values don't propagate to async stages
 * (CompletableFuture.supplyAsync), so tools read it before going async.
 */
public final class ToolCallContextHolder {

    private static final ThreadLocal<ToolCallContext> CONTEXT = new ThreadLocal<>();

    public static void set(ToolCallContext ctx) {
        CONTEXT.set(ctx);
    }

    public static ToolCallContext get() {
        return CONTEXT.get();
    }

    public static void clear() {
        CONTEXT.remove();
    }

    private ToolCallContextHolder() {
    }
}
