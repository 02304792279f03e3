package ai.customfit.sdk;

import static ai.customfit.sdk.TestUtil.requireNoMoreValues;
import static ai.customfit.sdk.TestUtil.requireValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

public class CFClientEndToEndTest {
    private static final String SETTINGS = "{\"cf_account_enabled\":true,\"cf_skip_sdk\":false}";

    @Rule
    public LogCaptureRule logging = new LogCaptureRule();

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private final InMemoryPersistentDataStore persistentStore = new InMemoryPersistentDataStore();
    private final InMemoryBlobStore blobStore = new InMemoryBlobStore();
    private final MockTransport transport = new MockTransport();
    private final CFUser user = new CFUser.Builder("user-1").build();

    private CFConfig.Builder configBuilder() {
        return new CFConfig.Builder(TestUtil.DIMENSION_CLIENT_KEY)
                .cacheDir(tempFolder.getRoot())
                .logAdapter(logging.logAdapter)
                .persistentDataStore(persistentStore)
                .blobStore(blobStore)
                .transport(transport);
    }

    private static String config(String heroText) {
        return "{\"configs\":{\"hero_text\":{\"variation\":\"" + heroText + "\"}}}";
    }

    @Test
    public void cachedConfigIsServedOfflineAndUpdatedWhenOnline() throws IOException {
        transport.serve("v1", null, SETTINGS, config("Hi"));
        try (CFClient first = CFClient.init(configBuilder().build(), user)) {
            assertTrue(TestUtil.awaitCondition(() -> "Hi".equals(first.getString("hero_text", "default")), 5000));
        }

        transport.clearRequests();
        try (CFClient second = CFClient.init(configBuilder().offline(true).build(), user)) {
            assertEquals("Hi", second.getString("hero_text", "default"));
            assertTrue(transport.getRequests().isEmpty());

            transport.serve("v2", null, SETTINGS, config("Hello"));
            BlockingQueue<String> changes = new LinkedBlockingQueue<>();
            second.registerConfigListener("hero_text", (key, value) -> changes.add(value.stringValue()));

            second.setOnline();
            assertEquals("Hello", requireValue(changes, 5, TimeUnit.SECONDS, "config change"));
            requireNoMoreValues(changes, 300, TimeUnit.MILLISECONDS, "second config change");
            assertEquals("Hello", second.getString("hero_text", "default"));
            assertEquals(1, transport.countConfigFetches());
        }
    }

    @Test
    public void eventsTrackedOfflineAreDeliveredByNextOnlineClient() throws IOException {
        try (CFClient offlineClient = CFClient.init(configBuilder().offline(true).build(), user)) {
            offlineClient.trackEvent("click");
            offlineClient.trackEvent("purchase");
        }
        assertTrue(transport.getRequests(MockTransport.METHOD_POST).isEmpty());

        try (CFClient onlineClient = CFClient.init(configBuilder().build(), user)) {
            onlineClient.flushEvents();
        }
        MockTransport.Request post = transport.getRequests(MockTransport.METHOD_POST).get(0);
        assertTrue(post.url.contains("/v1/cfe"));
        assertTrue(post.body.indexOf("click") < post.body.indexOf("purchase"));
    }
}
