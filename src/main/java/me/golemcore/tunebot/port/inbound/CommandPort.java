package me.golemcore.tunebot.port.inbound;

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

import me.golemcore.tunebot.domain.resilience.FailureKind;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Inbound port for executing chat commands.
 */
public interface CommandPort {

    String CONTEXT_CHAT_ID = "chatId";
    String CONTEXT_MESSAGE_ID = "messageId";
    String CONTEXT_DELETE_COMMAND = "deleteCommand";

    /**
     * Executes a command asynchronously. Every chat call of the command,
     * including deleting the command message and sending its output, happens
     * off the caller's thread.
     *
     * @param command
     *            command name without prefix, lower case
     * @param args
     *            whitespace-separated arguments
     * @param context
     *            {@link #CONTEXT_CHAT_ID} and optionally
     *            {@link #CONTEXT_MESSAGE_ID} and
     *            {@link #CONTEXT_DELETE_COMMAND}
     * @return result of the command, already delivered to the chat
     */
    CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context);

    boolean hasCommand(String command);

    List<CommandDefinition> listCommands();

    /**
     * Outcome of one command. {@code output} is {@code null} when the command
     * reported through its status message instead of a separate reply.
     */
    record CommandResult(boolean success, String output, FailureKind failure) {

        public static CommandResult success(String output) {
            return new CommandResult(true, output, null);
        }

        public static CommandResult delivered() {
            return new CommandResult(true, null, null);
        }

        public static CommandResult failure(FailureKind kind, String output) {
            return new CommandResult(false, output, kind);
        }
    }

    record CommandDefinition(String name, String usage) {
    }
}
