package com.avatarflow.pipeline;

import com.avatarflow.pipeline.scheduling.DispatchLock;
import com.avatarflow.pipeline.scheduling.LocalDispatchLock;
import com.avatarflow.pipeline.store.ContentStore;
import com.avatarflow.pipeline.store.InMemoryContentStore;
import com.avatarflow.platform.connector.PublisherRegistry;
import com.avatarflow.platform.connector.model.Platform;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class PipelineServiceApplicationTests {

    @Autowired
    private ContentStore contentStore;

    @Autowired
    private DispatchLock dispatchLock;

    @Autowired
    private PublisherRegistry publisherRegistry;

    @Test
    void contextLoads() {
        assertThat(contentStore).isInstanceOf(InMemoryContentStore.class);
        assertThat(dispatchLock).isInstanceOf(LocalDispatchLock.class);
        for (Platform platform : Platform.values()) {
            assertThat(publisherRegistry.find(platform)).isPresent();
        }
    }
}
