package me.golemcore.tunebot.infrastructure.i18n;

import me.golemcore.tunebot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class MessageServiceTest {

    private static MessageService forLanguage(String language) {
        BotProperties properties = new BotProperties();
        properties.setLanguage(language);
        return new MessageService(properties);
    }

    @Test
    void shouldReturnEnglishMessageByDefault() {
        assertEquals("No downloads yet", new MessageService(new BotProperties()).getMessage("command.last.empty"));
    }

    @Test
    void shouldReturnRussianMessageWhenConfigured() {
        MessageService messageService = forLanguage("ru");

        assertEquals("ru", messageService.getLanguage());
        assertEquals("\u0417\u0430\u0433\u0440\u0443\u0437\u043E\u043A \u043F\u043E\u043A\u0430 \u043D\u0435\u0442",
                messageService.getMessage("command.last.empty"));
    }

    @Test
    void shouldFallBackToEnglishForUnsupportedLanguage() {
        MessageService messageService = forLanguage("de");

        assertEquals("en", messageService.getLanguage());
        assertEquals("No downloads yet", messageService.getMessage("command.last.empty"));
    }

    @Test
    void shouldReturnKeyWhenMessageNotFound() {
        assertEquals("nonexistent.key", forLanguage("en").getMessage("nonexistent.key"));
    }

    @Test
    void shouldFormatMessageWithParameters() {
        MessageService messageService = forLanguage("en");

        assertEquals("Sent: Daft Punk - One More Time",
                messageService.getMessage("command.dl.done", "One More Time", "Daft Punk"));
        assertEquals("Cleared 12 message(s), skipped 0", messageService.getMessage("command.clear.done", 12, 0));
    }

    @Test
    void shouldDefineSameKeysInEveryBundle() throws IOException {
        Properties english = load("messages_en.properties");
        Properties russian = load("messages_ru.properties");

        assertEquals(english.stringPropertyNames(), russian.stringPropertyNames());
    }

    private static Properties load(String resource) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = MessageServiceTest.class.getClassLoader().getResourceAsStream(resource)) {
            assertNotNull(in, resource);
            properties.load(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
        return properties;
    }
}
