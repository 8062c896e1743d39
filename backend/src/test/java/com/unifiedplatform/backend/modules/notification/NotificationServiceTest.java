package com.unifiedplatform.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.unifiedplatform.backend.global.error.ProblemException;
import com.unifiedplatform.backend.modules.notification.application.NotificationService;
import com.unifiedplatform.backend.modules.notification.domain.Notification;
import com.unifiedplatform.backend.modules.notification.domain.NotificationType;
import com.unifiedplatform.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.unifiedplatform.backend.modules.notification.presentation.dto.CreateNotificationRequest;
import com.unifiedplatform.backend.modules.notification.presentation.dto.NotificationResponse;
import com.unifiedplatform.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    private static final UUID NOTIFICATION_ID = UUID.fromString("00000000-0000-0000-0000-000000001201");
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    @Mock
    private NotificationRepository notificationRepository;

    private NotificationService notificationService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        notificationService = new NotificationService(notificationRepository, clock);
    }

    @Test
    @DisplayName("type defaults to info and the read flag is honoured on create")
    void createDefaultsTypeAndHonoursReadFlag() {
        when(notificationRepository.save(any(Notification.class))).thenAnswer(invocation -> invocation.getArgument(0));

        Notification saved = notificationService.create(new CreateNotificationRequest(
                "member@example.org", " RU-01 ", "Welcome", "Glad to have you", null, true));

        assertThat(saved.getType()).isEqualTo(NotificationType.INFO);
        assertThat(saved.getBranchCode()).isEqualTo("RU-01");
        assertThat(saved.isRead()).isTrue();
        assertThat(saved.getReadAt()).isEqualTo(NOW);
    }

    @Test
    void createRejectsUnknownType() {
        assertThatThrownBy(() -> notificationService.create(new CreateNotificationRequest(
                null, "RU-01", "Title", "Body", "urgent", null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(ex.getCode()).isEqualTo("INVALID_TYPE");
                });
    }

    @Test
    void listPassesTrimmedFilters() {
        Notification stored = TestEntities.withId(new Notification(), NOTIFICATION_ID);
        stored.setTitle("Program request approved");
        stored.setMessage("ok");
        stored.setType(NotificationType.SUCCESS);
        when(notificationRepository.search("member@example.org", null)).thenReturn(List.of(stored));

        List<NotificationResponse> result = notificationService.listNotifications(" member@example.org ", " ");

        assertThat(result).singleElement().satisfies(response -> {
            assertThat(response.type()).isEqualTo("success");
            assertThat(response.isRead()).isFalse();
        });
    }

    @Test
    void markReadIsIdempotent() {
        Notification stored = TestEntities.withId(new Notification(), NOTIFICATION_ID);
        stored.markRead(NOW.minusDays(1));
        when(notificationRepository.findById(NOTIFICATION_ID)).thenReturn(Optional.of(stored));

        NotificationResponse response = notificationService.markRead(NOTIFICATION_ID);

        assertThat(response.isRead()).isTrue();
        assertThat(response.readAt()).isEqualTo(NOW.minusDays(1));
        verify(notificationRepository).findById(NOTIFICATION_ID);
    }

    @Test
    void markReadOfMissingNotificationIsNotFound() {
        when(notificationRepository.findById(NOTIFICATION_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> notificationService.markRead(NOTIFICATION_ID))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(NotificationService.NOTIFICATION_NOT_FOUND));
    }
}
