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
package dev.mars.redislite.store;

import dev.mars.redislite.resp.RespValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Interprets a request against a {@link KeyValueStore}.
 * <p>
 * Supported commands, matched case-insensitively:
 * <ul>
 *   <li>{@code PING [message]} - {@code +PONG}, or the message as a simple string</li>
 *   <li>{@code GET key} - the stored value, or null</li>
 *   <li>{@code SET key value} - {@code +OK}</li>
 *   <li>{@code DEL key [key ...]} - the number of keys removed</li>
 * </ul>
 * Invalid requests produce an {@link RespValue.Error}, never an exception. Dispatch does
 * no I/O; the only locking is the store's own, released before this method returns.
 */
public final class CommandDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(CommandDispatcher.class);

    private final KeyValueStore store;
    private final Map<String, Command> commands = new HashMap<>();

    public CommandDispatcher(KeyValueStore store) {
        this.store = store;
        commands.put("ping", this::ping);
        commands.put("get", this::get);
        commands.put("set", this::set);
        commands.put("del", this::del);
    }

    public KeyValueStore store() {
        return store;
    }

    /**
     * Executes one request.
     *
     * @param request expected to be an array whose first item names the command
     * @return the response; an {@link RespValue.Error} if the request is invalid
     */
    public RespValue dispatch(RespValue request) {
        if (!(request instanceof RespValue.Array array)) {
            return RespValue.error("only arrays accepted");
        }
        List<RespValue> items = array.items();
        Optional<String> name = items.isEmpty() ? Optional.empty() : RespValue.textOf(items.get(0));
        if (name.isEmpty()) {
            return RespValue.error("bulk string command expected");
        }

        Command command = commands.get(name.get().toLowerCase(Locale.ROOT));
        if (command == null) {
            LOG.trace("Unknown command: {}", name.get());
            return RespValue.error("invalid command");
        }
        return command.execute(items.subList(1, items.size()));
    }

    // ========================================================================
    // Commands
    // ========================================================================

    private RespValue ping(List<RespValue> args) {
        if (args.isEmpty()) {
            return RespValue.simpleString("PONG");
        }
        if (args.size() > 1) {
            return RespValue.error("wrong number of arguments for 'ping'");
        }
        return RespValue.textOf(args.get(0))
                .<RespValue>map(RespValue::simpleString)
                .orElseGet(() -> RespValue.error("invalid ping argument"));
    }

    private RespValue get(List<RespValue> args) {
        Optional<String> key = args.isEmpty() ? Optional.empty() : RespValue.textOf(args.get(0));
        if (key.isEmpty()) {
            return RespValue.error("missing key");
        }
        return store.get(key.get()).orElse(RespValue.NULL);
    }

    private RespValue set(List<RespValue> args) {
        if (args.size() < 2) {
            return RespValue.error("wrong number of arguments for 'set'");
        }
        Optional<String> key = RespValue.textOf(args.get(0));
        if (key.isEmpty()) {
            return RespValue.error("invalid key for set");
        }
        store.set(key.get(), args.get(1));
        return RespValue.simpleString("OK");
    }

    private RespValue del(List<RespValue> args) {
        List<String> keys = new ArrayList<>(args.size());
        for (RespValue arg : args) {
            RespValue.textOf(arg).ifPresent(keys::add);
        }
        return RespValue.integer(store.delete(keys));
    }
}
