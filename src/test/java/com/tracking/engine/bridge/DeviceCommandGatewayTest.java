package com.tracking.engine.bridge;

import com.tracking.engine.event.TrackingError;
import com.tracking.engine.event.TrackingEventBus;
import com.tracking.engine.event.TrackingEventListener;
import com.tracking.engine.exception.TrackingErrorKind;
import com.tracking.engine.platform.ProviderMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class DeviceCommandGatewayTest {

    private SimpMessagingTemplate messagingTemplate;
    private List<TrackingError> errors;
    private DeviceCommandGateway gateway;

    @BeforeEach
    void setUp() {
        messagingTemplate = mock(SimpMessagingTemplate.class);
        errors = new ArrayList<>();
        TrackingEventBus events = new TrackingEventBus();
        events.subscribe(new TrackingEventListener() {
            @Override
            public void onError(TrackingError error) {
                errors.add(error);
            }
        });
        gateway = new DeviceCommandGateway(messagingTemplate, events);
    }

    @Test
    void shouldSendCommandToDeviceTopic() {
        gateway.startActivityUpdates();

        verify(messagingTemplate).convertAndSend(eq(DeviceCommandGateway.COMMAND_TOPIC), any(Object.class));
        assertThat(errors).isEmpty();
    }

    @Test
    void shouldReportUndeliveredCommandAsProviderUnavailable() {
        doThrow(new MessageDeliveryException("broker unavailable"))
                .when(messagingTemplate).convertAndSend(eq(DeviceCommandGateway.COMMAND_TOPIC), any(Object.class));

        assertThatCode(() -> gateway.start(ProviderMode.HIGH_ACCURACY, 10.0)).doesNotThrowAnyException();

        assertThat(errors).singleElement().satisfies(error -> {
            assertThat(error.kind()).isEqualTo(TrackingErrorKind.PROVIDER_UNAVAILABLE);
            assertThat(error.message()).contains("location.start");
        });
    }
}
