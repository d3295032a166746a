package me.golemcore.tunebot.adapter.inbound.command;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.tunebot.domain.clear.AutoClearRegistry;
import me.golemcore.tunebot.domain.history.DownloadHistoryService;
import me.golemcore.tunebot.domain.model.ClearReport;
import me.golemcore.tunebot.domain.model.DownloadResult;
import me.golemcore.tunebot.domain.model.HistoryRecord;
import me.golemcore.tunebot.domain.model.MediaDescriptor;
import me.golemcore.tunebot.domain.model.MediaKind;
import me.golemcore.tunebot.domain.model.MediaLink;
import me.golemcore.tunebot.domain.model.Operation;
import me.golemcore.tunebot.domain.model.Recommendations;
import me.golemcore.tunebot.domain.progress.ProgressReporter;
import me.golemcore.tunebot.domain.progress.StatusHandle;
import me.golemcore.tunebot.domain.resilience.FailureKind;
import me.golemcore.tunebot.domain.resilience.OperationFailedException;
import me.golemcore.tunebot.domain.service.MediaLinkParser;
import me.golemcore.tunebot.domain.service.MetadataService;
import me.golemcore.tunebot.domain.service.OperationRunner;
import me.golemcore.tunebot.domain.service.ReplyService;
import me.golemcore.tunebot.domain.service.TrackDeliveryService;
import me.golemcore.tunebot.infrastructure.config.BotProperties;
import me.golemcore.tunebot.infrastructure.i18n.MessageService;
import me.golemcore.tunebot.port.inbound.CommandPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Routes prefixed chat commands to their handlers.
 *
 * <ul>
 * <li>search [-t|-v|-a|-p|-e] &lt;query&gt; - search YouTube Music</li>
 * <li>see [-t|-a|-p|-e] [-i] &lt;link|id&gt; - show details, optionally with
 * the cover</li>
 * <li>dl, download -t &lt;link&gt; | -a &lt;link&gt; | -s &lt;query&gt; -
 * download and send audio</li>
 * <li>last - list recent downloads</li>
 * <li>rec - recommendations from the listening history or the home feed</li>
 * <li>alast - recently played tracks of the signed-in account</li>
 * <li>likes - liked tracks of the signed-in account</li>
 * <li>clear - delete tracked bot messages</li>
 * <li>help - list commands</li>
 * </ul>
 *
 * <p>
 * Every command runs as one {@link Operation} on the {@link OperationRunner}.
 * Commands on the auto-clear list first clear the bot's previous output in the
 * chat.
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_SEARCH = "search";
    private static final String CMD_SEE = "see";
    private static final String CMD_DL = "dl";
    private static final String CMD_DOWNLOAD = "download";
    private static final String CMD_LAST = "last";
    private static final String CMD_REC = "rec";
    private static final String CMD_ALAST = "alast";
    private static final String CMD_LIKES = "likes";
    private static final String CMD_CLEAR = "clear";
    private static final String CMD_HELP = "help";

    private static final List<String> KNOWN_COMMANDS = List.of(
            CMD_SEARCH, CMD_SEE, CMD_DL, CMD_DOWNLOAD, CMD_LAST, CMD_REC, CMD_ALAST, CMD_LIKES, CMD_CLEAR, CMD_HELP);
    private static final Set<String> KNOWN_COMMAND_SET = Set.copyOf(KNOWN_COMMANDS);

    private static final String FLAG_TRACK = "-t";
    private static final String FLAG_VIDEO = "-v";
    private static final String FLAG_ALBUM = "-a";
    private static final String FLAG_PLAYLIST = "-p";
    private static final String FLAG_ARTIST = "-e";
    private static final String FLAG_COVER = "-i";
    private static final String FLAG_SEARCH = "-s";

    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String LINK_INDENT = "   ";
    private static final int MAX_QUERY_DISPLAY = 30;
    private static final int SECONDS_PER_MINUTE = 60;
    private static final int SECONDS_PER_HOUR = 3600;

    private final MetadataService metadataService;
    private final TrackDeliveryService deliveryService;
    private final DownloadHistoryService historyService;
    private final AutoClearRegistry clearRegistry;
    private final ProgressReporter progressReporter;
    private final ReplyService replyService;
    private final OperationRunner operationRunner;
    private final MessageService messages;
    private final BotProperties properties;
    private final Clock clock;

    public CommandRouter(
            MetadataService metadataService,
            TrackDeliveryService deliveryService,
            DownloadHistoryService historyService,
            AutoClearRegistry clearRegistry,
            ProgressReporter progressReporter,
            ReplyService replyService,
            OperationRunner operationRunner,
            MessageService messages,
            BotProperties properties,
            Clock clock) {
        this.metadataService = metadataService;
        this.deliveryService = deliveryService;
        this.historyService = historyService;
        this.clearRegistry = clearRegistry;
        this.progressReporter = progressReporter;
        this.replyService = replyService;
        this.operationRunner = operationRunner;
        this.messages = messages;
        this.properties = properties;
        this.clock = clock;
        log.info("CommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        String chatId = String.valueOf(context.get(CONTEXT_CHAT_ID));
        Object rawMessageId = context.get(CONTEXT_MESSAGE_ID);
        Integer messageId = rawMessageId instanceof Integer ? (Integer) rawMessageId : null;
        boolean deleteCommand = Boolean.TRUE.equals(context.get(CONTEXT_DELETE_COMMAND));
        Operation operation = new Operation(chatId, messageId, command, args, clock.instant());
        return operationRunner.submit(operation, () -> runAndReply(operation, deleteCommand));
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMAND_SET.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        String prefix = properties.getCommands().getPrefix();
        return List.of(
                new CommandDefinition(CMD_SEARCH, prefix + msg("command.search.usage-line")),
                new CommandDefinition(CMD_SEE, prefix + msg("command.see.usage-line")),
                new CommandDefinition(CMD_DL, prefix + msg("command.dl.usage-line")),
                new CommandDefinition(CMD_LAST, prefix + msg("command.last.usage-line")),
                new CommandDefinition(CMD_REC, prefix + msg("command.rec.usage-line")),
                new CommandDefinition(CMD_ALAST, prefix + msg("command.alast.usage-line")),
                new CommandDefinition(CMD_LIKES, prefix + msg("command.likes.usage-line")),
                new CommandDefinition(CMD_CLEAR, prefix + msg("command.clear.usage-line")),
                new CommandDefinition(CMD_HELP, prefix + msg("command.help.usage-line")));
    }

    /**
     * Runs the command on the operation thread: deletes the command message
     * when asked to, runs the handler and sends its output.
     */
    CommandResult runAndReply(Operation operation, boolean deleteCommand) {
        if (deleteCommand && operation.getMessageId() != null) {
            replyService.tryDelete(operation.getChatId(), operation.getMessageId());
        }
        CommandResult result;
        try {
            result = run(operation);
        } catch (RuntimeException e) {
            log.error("Command {} crashed", operation.getCommand(), e);
            result = CommandResult.failure(FailureKind.FATAL, msg(FailureKind.FATAL.messageKey(), e.getMessage()));
        }
        if (result.output() != null && !result.output().isBlank()) {
            replyService.trySend(operation.getChatId(), result.output());
        }
        return result;
    }

    CommandResult run(Operation operation) {
        String command = operation.getCommand();
        if (!hasCommand(command)) {
            return CommandResult.failure(null, msg("command.unknown", command, properties.getCommands().getPrefix()));
        }
        log.debug("Executing command: {} {} (op {})", command, operation.getArgs(), operation.getToken());

        if (!CMD_CLEAR.equals(command) && clearRegistry.isAutoClearCommand(command)) {
            clearRegistry.clear(operation.getChatId());
        }

        try {
            return switch (command) {
            case CMD_SEARCH -> handleSearch(operation);
            case CMD_SEE -> handleSee(operation);
            case CMD_DL, CMD_DOWNLOAD -> handleDownload(operation);
            case CMD_LAST -> handleLast();
            case CMD_REC -> handleRecommendations(operation);
            case CMD_ALAST -> handleListeningHistory(operation);
            case CMD_LIKES -> handleLikedTracks(operation);
            case CMD_CLEAR -> handleClear(operation);
            case CMD_HELP -> handleHelp();
            default -> CommandResult.failure(null, msg("command.unknown", command,
                    properties.getCommands().getPrefix()));
            };
        } catch (OperationFailedException e) {
            log.warn("Command {} failed: {}", command, e.getMessage());
            return CommandResult.failure(e.getKind(), failureText(e));
        } catch (RuntimeException e) {
            log.error("Command {} failed unexpectedly", command, e);
            return CommandResult.failure(FailureKind.FATAL, msg(FailureKind.FATAL.messageKey(), e.getMessage()));
        }
    }

    // ==================== search ====================

    private CommandResult handleSearch(Operation operation) {
        MediaKind kind = null;
        boolean videos = false;
        List<String> queryParts = new ArrayList<>();
        for (String arg : operation.getArgs()) {
            Optional<MediaKind> flagKind = kindForFlag(arg);
            if (flagKind.isPresent()) {
                if (kind == null) {
                    kind = flagKind.get();
                }
            } else if (FLAG_VIDEO.equals(arg)) {
                videos = true;
            } else {
                queryParts.add(arg);
            }
        }
        String query = String.join(" ", queryParts).trim();
        if (query.isEmpty()) {
            return CommandResult.success(msg("command.search.usage", properties.getCommands().getPrefix()));
        }
        MediaKind searchKind = kind == null || kind == MediaKind.TRACK
                ? (videos ? MediaKind.VIDEO : MediaKind.TRACK)
                : kind;
        int limit = searchLimit();

        return withStatus(operation, msg("command.search.progress", kindLabel(searchKind), shorten(query)),
                status -> {
                    List<MediaDescriptor> results = metadataService.search(query, searchKind, limit);
                    if (results.isEmpty()) {
                        return msg("command.search.empty", query, kindLabel(searchKind));
                    }
                    StringBuilder sb = new StringBuilder(msg("command.search.title", kindLabel(searchKind), query));
                    sb.append(NEWLINE);
                    int index = 1;
                    for (MediaDescriptor item : results) {
                        sb.append(NEWLINE).append(formatListItem(index++, item));
                    }
                    return sb.toString();
                });
    }

    private int searchLimit() {
        BotProperties.CommandProperties commands = properties.getCommands();
        return Math.min(Math.max(1, commands.getSearchLimit()), commands.getMaxSearchLimit());
    }

    // ==================== see ====================

    private CommandResult handleSee(Operation operation) {
        MediaKind hint = null;
        boolean withCover = false;
        String target = null;
        for (String arg : operation.getArgs()) {
            Optional<MediaKind> flagKind = kindForFlag(arg);
            if (flagKind.isPresent()) {
                hint = flagKind.get();
            } else if (FLAG_COVER.equals(arg)) {
                withCover = true;
            } else if (target == null) {
                target = arg;
            } else {
                log.debug("Ignoring extra argument for see: {}", arg);
            }
        }
        if (target == null) {
            return CommandResult.success(msg("command.see.usage", properties.getCommands().getPrefix()));
        }
        Optional<MediaLink> link = MediaLinkParser.parse(target, hint);
        if (link.isEmpty()) {
            return CommandResult.failure(null, msg("command.invalid-link", target));
        }

        MediaLink resolved = link.get();
        boolean sendCover = withCover;
        return withStatus(operation, msg("command.see.progress", kindLabel(resolved.kind())), status -> {
            MediaDescriptor entity = metadataService.getEntity(resolved.kind(), resolved.id());
            if (sendCover) {
                sendCover(operation, entity);
            }
            return formatDetails(entity);
        });
    }

    private void sendCover(Operation operation, MediaDescriptor entity) {
        if (entity.getThumbnailUrl() == null) {
            return;
        }
        try {
            byte[] image = metadataService.artwork(entity.getThumbnailUrl());
            replyService.sendPhoto(operation.getChatId(), image, entity.getTitle());
        } catch (OperationFailedException e) {
            log.warn("Cover for {} not sent: {}", entity.getId(), e.getMessage());
        }
    }

    // ==================== dl ====================

    private CommandResult handleDownload(Operation operation) {
        List<String> args = operation.getArgs();
        String prefix = properties.getCommands().getPrefix();
        if (args.isEmpty()) {
            return CommandResult.success(msg("command.dl.usage", prefix));
        }
        String flag = args.get(0).toLowerCase(Locale.ROOT);
        String target = String.join(" ", args.subList(1, args.size())).trim();
        if (!Set.of(FLAG_TRACK, FLAG_ALBUM, FLAG_SEARCH).contains(flag) || target.isEmpty()) {
            return CommandResult.success(msg("command.dl.usage", prefix));
        }

        if (FLAG_SEARCH.equals(flag)) {
            return withStatus(operation, msg("command.dl.searching", shorten(target)), status -> {
                Optional<MediaDescriptor> found = firstPlayable(target);
                if (found.isEmpty()) {
                    return msg("command.dl.not-found", target);
                }
                return downloadTrack(operation, found.get(), status);
            });
        }

        Optional<MediaLink> link = MediaLinkParser.parse(target, null);
        if (link.isEmpty()) {
            return CommandResult.failure(null, msg("command.invalid-link", target));
        }
        MediaLink resolved = link.get();
        if (FLAG_TRACK.equals(flag)) {
            if (!resolved.kind().isPlayable()) {
                return CommandResult.failure(null, msg("command.dl.not-a-track", target));
            }
            return withStatus(operation, msg("command.dl.requested", resolved.id()),
                    status -> downloadTrack(operation, resolved, status));
        }
        if (!resolved.kind().isCollection()) {
            return CommandResult.failure(null, msg("command.dl.not-a-collection", target));
        }
        return withStatus(operation, msg("command.dl.requested", resolved.id()),
                status -> downloadCollection(operation, resolved, status));
    }

    private Optional<MediaDescriptor> firstPlayable(String query) {
        List<MediaDescriptor> songs = metadataService.search(query, MediaKind.TRACK, 1);
        if (!songs.isEmpty()) {
            return Optional.of(songs.get(0));
        }
        List<MediaDescriptor> videos = metadataService.search(query, MediaKind.VIDEO, 1);
        return videos.isEmpty() ? Optional.empty() : Optional.of(videos.get(0));
    }

    private String downloadTrack(Operation operation, MediaDescriptor found, StatusHandle status) {
        return downloadTrack(operation, new MediaLink(found.getKind(), found.getId()), status);
    }

    private String downloadTrack(Operation operation, MediaLink link, StatusHandle status) {
        MediaDescriptor track = metadataService.getEntity(link.kind(), link.id());
        DownloadResult result = deliveryService.deliver(operation, track, status, "");
        return msg("command.dl.done", result.getTitle(), result.getArtist());
    }

    private String downloadCollection(Operation operation, MediaLink link, StatusHandle status) {
        MediaDescriptor collection = metadataService.getEntity(link.kind(), link.id());
        List<MediaDescriptor> tracks = collection.getTracks().stream()
                .filter(track -> track.getKind() != null && track.getKind().isPlayable() && track.getId() != null)
                .toList();
        if (tracks.isEmpty()) {
            return msg("command.dl.empty-collection", collection.getTitle());
        }

        int delivered = 0;
        List<String> failures = new ArrayList<>();
        for (int i = 0; i < tracks.size(); i++) {
            if (operation.isCancelled()) {
                throw new OperationFailedException(FailureKind.CANCELLED,
                        "stopped after " + delivered + " of " + tracks.size() + " tracks");
            }
            MediaDescriptor track = withCollectionDefaults(tracks.get(i), collection);
            String progressPrefix = (i + 1) + "/" + tracks.size() + " ";
            try {
                deliveryService.deliver(operation, track, status, progressPrefix);
                delivered++;
            } catch (OperationFailedException e) {
                if (e.getKind() == FailureKind.CANCELLED) {
                    throw e;
                }
                log.warn("[Download] Track {} of {} ({}) failed: {}", i + 1, tracks.size(), track.getId(),
                        e.getMessage());
                failures.add(track.getTitle() + ": " + msg(e.getKind().messageKey(), e.getDetail()));
            }
        }

        StringBuilder sb = new StringBuilder(msg("command.dl.collection-done",
                collection.getTitle(), delivered, tracks.size()));
        if (!failures.isEmpty()) {
            sb.append(DOUBLE_NEWLINE).append(msg("command.dl.collection-failures", failures.size()));
            for (String failure : failures) {
                sb.append(NEWLINE).append("- ").append(failure);
            }
        }
        return sb.toString();
    }

    private static MediaDescriptor withCollectionDefaults(MediaDescriptor track, MediaDescriptor collection) {
        return MediaDescriptor.builder()
                .kind(track.getKind())
                .id(track.getId())
                .title(track.getTitle())
                .artists(track.getArtists() != null && !track.getArtists().isEmpty()
                        ? track.getArtists()
                        : collection.getArtists())
                .album(track.getAlbum() != null ? track.getAlbum()
                        : collection.getKind() == MediaKind.ALBUM ? collection.getTitle() : null)
                .year(track.getYear() != null ? track.getYear() : collection.getYear())
                .durationSeconds(track.getDurationSeconds())
                .thumbnailUrl(track.getThumbnailUrl() != null ? track.getThumbnailUrl() : collection.getThumbnailUrl())
                .build();
    }

    // ==================== rec / alast / likes ====================

    private CommandResult handleRecommendations(Operation operation) {
        int limit = Math.max(1, properties.getCommands().getRecommendationsLimit());
        return withStatus(operation, msg("command.rec.progress"), status -> {
            Recommendations found = metadataService.recommendations(limit);
            if (found.tracks().isEmpty()) {
                return msg("command.rec.empty");
            }
            String titleKey = found.source() == Recommendations.Source.LISTENING_HISTORY
                    ? "command.rec.title.history"
                    : "command.rec.title.home";
            return trackList(msg(titleKey, found.tracks().size()), found.tracks());
        });
    }

    private CommandResult handleListeningHistory(Operation operation) {
        int limit = Math.max(1, properties.getCommands().getHistoryLimit());
        return withStatus(operation, msg("command.alast.progress"), status -> {
            List<MediaDescriptor> tracks = metadataService.listeningHistory(limit);
            return tracks.isEmpty()
                    ? msg("command.alast.empty")
                    : trackList(msg("command.alast.title", tracks.size()), tracks);
        });
    }

    private CommandResult handleLikedTracks(Operation operation) {
        int limit = Math.max(1, properties.getCommands().getLikedLimit());
        return withStatus(operation, msg("command.likes.progress"), status -> {
            List<MediaDescriptor> tracks = metadataService.likedTracks(limit);
            return tracks.isEmpty()
                    ? msg("command.likes.empty")
                    : trackList(msg("command.likes.title", tracks.size()), tracks);
        });
    }

    private String trackList(String title, List<MediaDescriptor> tracks) {
        StringBuilder sb = new StringBuilder(title);
        sb.append(NEWLINE);
        int index = 1;
        for (MediaDescriptor track : tracks) {
            sb.append(NEWLINE).append(formatListItem(index++, track));
        }
        return sb.toString();
    }

    // ==================== last / clear / help ====================

    private CommandResult handleLast() {
        if (!historyService.isEnabled()) {
            return CommandResult.success(msg("command.last.disabled"));
        }
        StringBuilder sb = new StringBuilder();
        int index = 1;
        for (HistoryRecord record : historyService.load()) {
            sb.append(NEWLINE).append(index++).append(". ")
                    .append(record.getArtist()).append(" - ").append(record.getTitle());
            if (record.hasKnownDuration()) {
                sb.append(" (").append(formatDuration(record.getDurationSeconds())).append(")");
            }
            if (record.getSourceUrl() != null) {
                sb.append(NEWLINE).append(LINK_INDENT).append(record.getSourceUrl());
            }
        }
        if (index == 1) {
            return CommandResult.success(msg("command.last.empty"));
        }
        return CommandResult.success(msg("command.last.title", index - 1) + NEWLINE + sb);
    }

    private CommandResult handleClear(Operation operation) {
        ClearReport report = clearRegistry.clear(operation.getChatId());
        return CommandResult.success(msg("command.clear.done", report.deleted(), report.skipped()));
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder(msg("command.help.title"));
        sb.append(NEWLINE);
        for (CommandDefinition definition : listCommands()) {
            sb.append(NEWLINE).append(definition.usage());
        }
        return CommandResult.success(sb.toString());
    }

    // ==================== helpers ====================

    /**
     * Runs {@code body} behind a status message and always finishes it: with
     * the body's text on success, with a localized failure line otherwise.
     * Text produced after the operation was cancelled is discarded.
     */
    private CommandResult withStatus(Operation operation, String initialText, Function<StatusHandle, String> body) {
        StatusHandle status = progressReporter.begin(operation, initialText);
        try {
            String text = body.apply(status);
            if (operation.isCancelled()) {
                log.warn("Command {} (op {}) finished after its deadline, result discarded",
                        operation.getCommand(), operation.getToken());
                progressReporter.finish(status, msg(FailureKind.CANCELLED.messageKey(), msg("operation.timed-out")));
                return CommandResult.failure(FailureKind.CANCELLED, null);
            }
            progressReporter.finish(status, text);
            return CommandResult.delivered();
        } catch (OperationFailedException e) {
            log.warn("Command {} failed: {}", operation.getCommand(), e.getMessage());
            progressReporter.finish(status, failureText(e));
            return CommandResult.failure(e.getKind(), null);
        } catch (RuntimeException e) {
            log.error("Command {} failed unexpectedly", operation.getCommand(), e);
            progressReporter.finish(status, msg(FailureKind.FATAL.messageKey(), e.getMessage()));
            return CommandResult.failure(FailureKind.FATAL, null);
        }
    }

    private String failureText(OperationFailedException e) {
        return msg(e.getKind().messageKey(), e.getDetail());
    }

    private String formatListItem(int index, MediaDescriptor item) {
        StringBuilder line = new StringBuilder().append(index).append(". ").append(item.getTitle());
        String artists = item.artistLine();
        switch (item.getKind()) {
        case TRACK, VIDEO -> {
            if (!artists.isEmpty()) {
                line.append(" - ").append(artists);
            }
            if (item.getDurationSeconds() != null) {
                line.append(" (").append(formatDuration(item.getDurationSeconds())).append(")");
            }
        }
        case ALBUM -> {
            if (!artists.isEmpty()) {
                line.append(" - ").append(artists);
            }
            if (item.getYear() != null) {
                line.append(" (").append(item.getYear()).append(")");
            }
        }
        case PLAYLIST, ARTIST -> {
            if (item.getSubtitle() != null && !item.getSubtitle().isBlank()) {
                line.append(" [").append(item.getSubtitle()).append("]");
            }
        }
        }
        if (item.getUrl() != null) {
            line.append(NEWLINE).append(LINK_INDENT).append(item.getUrl());
        }
        return line.toString();
    }

    private String formatDetails(MediaDescriptor entity) {
        StringBuilder sb = new StringBuilder();
        sb.append(kindLabel(entity.getKind())).append(": ").append(entity.getTitle());
        String artists = entity.artistLine();
        if (!artists.isEmpty() && entity.getKind() != MediaKind.ARTIST) {
            sb.append(NEWLINE).append(msg("see.artists", artists));
        }
        if (entity.getAlbum() != null && !entity.getAlbum().isBlank()) {
            sb.append(NEWLINE).append(msg("see.album", entity.getAlbum()));
        }
        if (entity.getYear() != null) {
            sb.append(NEWLINE).append(msg("see.year", entity.getYear()));
        }
        if (entity.getDurationSeconds() != null) {
            sb.append(NEWLINE).append(msg("see.duration", formatDuration(entity.getDurationSeconds())));
        }
        if (entity.getSubtitle() != null && !entity.getSubtitle().isBlank()) {
            sb.append(NEWLINE).append(entity.getSubtitle());
        }

        List<MediaDescriptor> tracks = entity.getTracks();
        if (tracks != null && !tracks.isEmpty()) {
            String heading = entity.getKind() == MediaKind.ARTIST ? "see.top-songs" : "see.tracks";
            sb.append(DOUBLE_NEWLINE).append(msg(heading, tracks.size()));
            int shown = Math.min(tracks.size(), properties.getCommands().getMaxListedTracks());
            for (int i = 0; i < shown; i++) {
                MediaDescriptor track = tracks.get(i);
                sb.append(NEWLINE).append(i + 1).append(". ").append(track.getTitle());
                if (entity.getKind() != MediaKind.ALBUM && !track.artistLine().isEmpty()) {
                    sb.append(" - ").append(track.artistLine());
                }
                if (track.getDurationSeconds() != null) {
                    sb.append(" (").append(formatDuration(track.getDurationSeconds())).append(")");
                }
            }
            if (tracks.size() > shown) {
                sb.append(NEWLINE).append(msg("see.more", tracks.size() - shown));
            }
        }
        if (entity.getUrl() != null) {
            sb.append(DOUBLE_NEWLINE).append(entity.getUrl());
        }
        return sb.toString();
    }

    private static Optional<MediaKind> kindForFlag(String arg) {
        return switch (arg) {
        case FLAG_TRACK -> Optional.of(MediaKind.TRACK);
        case FLAG_ALBUM -> Optional.of(MediaKind.ALBUM);
        case FLAG_PLAYLIST -> Optional.of(MediaKind.PLAYLIST);
        case FLAG_ARTIST -> Optional.of(MediaKind.ARTIST);
        default -> Optional.empty();
        };
    }

    private String kindLabel(MediaKind kind) {
        return msg("kind." + kind.name().toLowerCase(Locale.ROOT));
    }

    static String formatDuration(int totalSeconds) {
        if (totalSeconds < 0) {
            return "?";
        }
        int hours = totalSeconds / SECONDS_PER_HOUR;
        int minutes = (totalSeconds % SECONDS_PER_HOUR) / SECONDS_PER_MINUTE;
        int seconds = totalSeconds % SECONDS_PER_MINUTE;
        return hours > 0
                ? String.format("%d:%02d:%02d", hours, minutes, seconds)
                : String.format("%d:%02d", minutes, seconds);
    }

    private static String shorten(String text) {
        return text.length() > MAX_QUERY_DISPLAY + 3 ? text.substring(0, MAX_QUERY_DISPLAY) + "..." : text;
    }

    private String msg(String key, Object... args) {
        return messages.getMessage(key, args);
    }
}
