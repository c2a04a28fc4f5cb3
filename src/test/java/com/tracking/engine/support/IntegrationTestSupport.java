package com.tracking.engine.support;

import com.tracking.engine.platform.NetworkTransport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;

/**
 * Shared Spring context for tests that need persistence or the full session.
 * Keeping the setup identical lets every such test class reuse one context.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TrackingTestConfig.class)
public abstract class IntegrationTestSupport {

    @MockBean
    protected NetworkTransport networkTransport;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected ManualTimerService timers;
}
