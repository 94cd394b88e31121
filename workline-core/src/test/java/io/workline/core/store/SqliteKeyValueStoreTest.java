package io.workline.core.store;

import static org.assertj.core.api.Assertions.assertThat;

import io.workline.core.MutableClock;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteKeyValueStoreTest extends KeyValueStoreContractTest {

    @TempDir
    Path tempDir;

    @Override
    protected KeyValueStore createStore(MutableClock clock) throws Exception {
        return new SqliteKeyValueStore(tempDir.resolve("state/workline.db"), clock);
    }

    @Test
    void shouldSurviveReopeningTheDatabase() throws Exception {
        store.put("CALL_SESSION:abc", "{\"status\":\"ACTIVE\"}", Duration.ofHours(48));

        SqliteKeyValueStore reopened = new SqliteKeyValueStore(tempDir.resolve("state/workline.db"), clock);

        assertThat(reopened.get("CALL_SESSION:abc")).contains("{\"status\":\"ACTIVE\"}");
    }
}
