package at.sv.tide.tide;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;

import static at.sv.tide.tide.TideTableParserTest.withHeader;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TideTableLoaderTest {

    @Mock
    private TideResourceProvider provider;

    private List<Runnable> tasks;
    private TideEventStore store;
    private TideTableLoader loader;

    private static InputStream table(String... rows) {
        return new ByteArrayInputStream(withHeader(rows).getBytes(StandardCharsets.UTF_8));
    }

    private void runAllTasks() {
        for (int i = 0; i < tasks.size(); i++) {
            tasks.get(i).run();
        }
    }

    @BeforeEach
    void setUp() {
        tasks = new ArrayList<>();
        store = new TideEventStore(provider, TideStoreConfig.defaults());
        loader = new TideTableLoader(store, tasks::add);
    }

    @AfterEach
    void tearDown() {
        Thread.interrupted();
    }

    @Test
    void requestLoad_publishesWhenRun() throws IOException {
        when(provider.open("A", 2023)).thenAnswer(invocation -> table("2023/06/01 Thu 04:38 AM 4.29 131 H"));

        Future<?> future = loader.requestLoad("A", List.of(2023));

        assertThat(store.getCurrent().isPresent(), is(false));
        runAllTasks();
        assertThat(future.isDone(), is(true));
        assertThat(store.getCurrentTable().orElseThrow().getStationId(), is("A"));
    }

    @Test
    void requestLoad_cancelsPendingLoad() throws IOException {
        when(provider.open("B", 2023)).thenAnswer(invocation -> table("2023/06/01 Thu 04:38 AM 4.29 131 H"));

        Future<?> first = loader.requestLoad("A", List.of(2023));
        Future<?> second = loader.requestLoad("B", List.of(2023));
        runAllTasks();

        assertThat(first.isCancelled(), is(true));
        assertThat(second.isCancelled(), is(false));
        assertThat(store.getCurrentTable().orElseThrow().getStationId(), is("B"));
    }

    @Test
    void requestLoad_supersededWhileRunning_resultDiscarded() throws IOException {
        when(provider.open("A", 2023)).thenAnswer(invocation -> {
            loader.requestLoad("B", List.of(2023));
            return table("2023/06/01 Thu 04:38 AM 4.29 131 H");
        });
        when(provider.open("B", 2023)).thenAnswer(invocation -> table("2023/06/01 Thu 04:38 AM 1.00 30 H"));

        loader.requestLoad("A", List.of(2023));
        tasks.get(0).run();
        Thread.interrupted();

        assertThat(store.getCurrent().isPresent(), is(false));

        tasks.get(1).run();

        assertThat(store.getCurrentTable().orElseThrow().getStationId(), is("B"));
    }

    @Test
    void requestLoad_failure_keepsPreviousTable() throws IOException {
        when(provider.open("A", 2023)).thenAnswer(invocation -> table("2023/06/01 Thu 04:38 AM 4.29 131 H"));
        when(provider.open("B", 2023)).thenThrow(new TideResourceMissingException("missing"));

        loader.requestLoad("A", List.of(2023));
        runAllTasks();
        loader.requestLoad("B", List.of(2023));
        runAllTasks();

        assertThat(store.getCurrentTable().orElseThrow().getStationId(), is("A"));
    }

    @Test
    void requestLoad_directExecutor_publishesImmediately() throws IOException {
        when(provider.open("A", 2023)).thenAnswer(invocation -> table("2023/06/01 Thu 04:38 AM 4.29 131 H"));
        TideTableLoader direct = new TideTableLoader(store, Runnable::run);

        direct.requestLoad("A", List.of(2023));

        assertThat(store.getCurrentTable().orElseThrow().size(), is(1));
        assertThat(direct.getStore(), is(store));
    }
}
