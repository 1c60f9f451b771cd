package me.golemcore.imbot.domain.model.config;

import me.golemcore.imbot.domain.model.Platform;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BotConfigTest {

    @Test
    void shouldRejectTokenAuthWithoutToken() {
        BotConfig config = BotConfig.builder()
                .platform(Platform.TELEGRAM)
                .auth(AuthConfig.builder().type(AuthType.TOKEN).build())
                .build();

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, config::validate);

        assertTrue(error.getMessage().contains("token is required"), error.getMessage());
        assertTrue(error.getMessage().startsWith("invalid auth config: "));
    }

    @Test
    void shouldRejectMissingPlatform() {
        BotConfig config = BotConfig.builder()
                .auth(AuthConfig.builder().type(AuthType.NONE).build())
                .build();

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class, config::validate);

        assertEquals("invalid platform: null", error.getMessage());
    }

    @Test
    void shouldApplyPerAuthTypeRules() {
        assertThrows(IllegalArgumentException.class, () -> auth(AuthConfig.builder().type(AuthType.BASIC)).validate());
        assertThrows(IllegalArgumentException.class,
                () -> auth(AuthConfig.builder().type(AuthType.OAUTH).clientId("id")).validate());
        assertThrows(IllegalArgumentException.class,
                () -> auth(AuthConfig.builder().type(AuthType.SERVICE_ACCOUNT)).validate());
        assertDoesNotThrow(() -> auth(AuthConfig.builder().type(AuthType.QR)).validate());
        assertDoesNotThrow(() -> auth(AuthConfig.builder().type(AuthType.NONE)).validate());
        assertDoesNotThrow(
                () -> auth(AuthConfig.builder().type(AuthType.OAUTH).clientId("id").clientSecret("s")).validate());
    }

    @Test
    void shouldExpandEnvironmentReferencesInCopy() {
        BotConfig config = BotConfig.builder()
                .platform(Platform.SLACK)
                .auth(AuthConfig.builder().type(AuthType.TOKEN).token("$SLACK_TOKEN").build())
                .options(Map.of("channel", "$SLACK_CHANNEL", "missing", "$NOT_SET", "plain", "value", "n", 3))
                .build();
        Map<String, String> env = Map.of("SLACK_TOKEN", "xoxb-1", "SLACK_CHANNEL", "general");

        BotConfig expanded = config.expandEnvVars(env::get);

        assertEquals("xoxb-1", expanded.getAuth().getToken());
        assertEquals("general", expanded.getOptionString("channel", null));
        assertEquals("", expanded.getOptions().get("missing"));
        assertEquals("value", expanded.getOptionString("plain", null));
        assertEquals(3, expanded.getOptionInt("n", 0));
        assertEquals("$SLACK_TOKEN", config.getAuth().getToken());
    }

    @Test
    void shouldReadOptionsFromNativeAndStringValues() {
        BotConfig config = BotConfig.builder()
                .platform(Platform.WEBCHAT)
                .options(Map.of(
                        "flag", "true",
                        "nativeFlag", false,
                        "size", "25",
                        "allowFrom", "1, 2,3",
                        "list", List.of("a", "b")))
                .build();

        assertTrue(config.getOptionBool("flag", false));
        assertFalse(config.getOptionBool("nativeFlag", true));
        assertTrue(config.getOptionBool("absent", true));
        assertEquals(25, config.getOptionInt("size", 0));
        assertEquals(7, config.getOptionInt("absent", 7));
        assertEquals("fallback", config.getOptionString("absent", "fallback"));
        assertEquals(List.of("1", "2", "3"), config.getOptionList("allowFrom"));
        assertEquals(List.of("a", "b"), config.getOptionList("list"));
        assertEquals(List.of(), config.getOptionList("absent"));
    }

    @Test
    void shouldRejectNonNumericIntOption() {
        BotConfig config = BotConfig.builder().options(Map.of("size", "big")).build();

        assertThrows(IllegalArgumentException.class, () -> config.getOptionInt("size", 0));
    }

    @Test
    void shouldFilterEnabledConfigs() {
        BotConfig enabled = BotConfig.builder().platform(Platform.WEBCHAT).build();
        BotConfig disabled = BotConfig.builder().platform(Platform.TELEGRAM).enabled(false).build();

        assertEquals(List.of(enabled), BotConfig.enabled(List.of(enabled, disabled)));
    }

    private static BotConfig auth(AuthConfig.AuthConfigBuilder auth) {
        return BotConfig.builder().platform(Platform.SLACK).auth(auth.build()).build();
    }
}
