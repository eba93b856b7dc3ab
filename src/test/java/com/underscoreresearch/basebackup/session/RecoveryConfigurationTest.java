package com.underscoreresearch.basebackup.session;

import static org.hamcrest.MatcherAssert.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import org.hamcrest.core.Is;
import org.junit.jupiter.api.Test;

class RecoveryConfigurationTest {
    private static Map<String, String> parameters(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    @Test
    public void testConnectionString() {
        assertThat(RecoveryConfiguration.connectionString(parameters("user", "postgres", "host", "db.example.com",
                "port", "5432")), Is.is("user=postgres host=db.example.com port=5432"));
        assertThat(RecoveryConfiguration.connectionString(parameters("user", "postgres", "password", null)),
                Is.is("user=postgres"));
    }

    @Test
    public void testQuoting() {
        assertThat(RecoveryConfiguration.quoteConnectionValue("my host"), Is.is("'my host'"));
        assertThat(RecoveryConfiguration.quoteConnectionValue(""), Is.is("''"));
        assertThat(RecoveryConfiguration.quoteConnectionValue("it's"), Is.is("'it\\'s'"));
        assertThat(RecoveryConfiguration.quoteConnectionValue("a\\b"), Is.is("'a\\\\b'"));

        assertThat(RecoveryConfiguration.quoteSetting("it's"), Is.is("'it''s'"));
        assertThat(RecoveryConfiguration.quoteSetting("a\\b"), Is.is("'a\\\\b'"));
    }

    @Test
    public void testRender() {
        byte[] rendered = RecoveryConfiguration.render(parameters("user", "postgres", "host", "localhost",
                "port", "5432"), "standby_1");
        assertThat(new String(rendered, StandardCharsets.UTF_8), Is.is(
                "primary_conninfo = 'user=postgres host=localhost port=5432'\n"
                        + "primary_slot_name = 'standby_1'\n"));

        rendered = RecoveryConfiguration.render(parameters("user", "o'neil"), null);
        assertThat(new String(rendered, StandardCharsets.UTF_8), Is.is(
                "primary_conninfo = 'user=''o\\\\''neil'''\n"));
    }
}
