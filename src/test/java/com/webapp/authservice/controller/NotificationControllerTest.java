package com.webapp.authservice.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.webapp.authservice.dto.NotificationQuery;
import com.webapp.authservice.dto.NotificationResponse;
import com.webapp.authservice.entity.NotificationStatus;
import com.webapp.authservice.entity.NotificationType;
import com.webapp.authservice.entity.User;
import com.webapp.authservice.exception.GlobalExceptionHandler;
import com.webapp.authservice.service.NotificationService;
import com.webapp.authservice.support.TestUsers;
import com.webapp.authservice.utils.ErrorResponseWriter;
import com.webapp.authservice.utils.SuccessEnvelopeAdvice;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class NotificationControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private NotificationService notificationService;

    private MockMvc mockMvc;
    private User alice;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
        mockMvc = MockMvcBuilders.standaloneSetup(new NotificationController(notificationService, clock))
                .setControllerAdvice(new SuccessEnvelopeAdvice(clock),
                        new GlobalExceptionHandler(new ErrorResponseWriter(objectMapper, clock)))
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .build();

        alice = TestUsers.confirmed("alice");
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(alice, null, alice.getAuthorities()));
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private NotificationResponse notification(NotificationType type, NotificationStatus status) {
        return NotificationResponse.builder()
                .id(UUID.randomUUID())
                .recipientId(alice.getId())
                .type(type)
                .status(status)
                .title("New Like")
                .message("Bob liked your post")
                .createdAt(NOW)
                .build();
    }

    @Test
    void listBindsFiltersPagingAndSortIntoTheQuery() throws Exception {
        NotificationResponse like = notification(NotificationType.LIKE, NotificationStatus.UNREAD);
        when(notificationService.list(eq(alice), any(NotificationQuery.class)))
                .thenReturn(new PageImpl<>(List.of(like), PageRequest.of(1, 50), 51));

        mockMvc.perform(get("/notifications")
                        .param("type", "LIKE")
                        .param("status", "UNREAD")
                        .param("includeExpired", "true")
                        .param("page", "1")
                        .param("size", "50")
                        .param("sortBy", "readAt")
                        .param("sortDirection", "asc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value(like.getId().toString()))
                .andExpect(jsonPath("$.meta.page").value(1))
                .andExpect(jsonPath("$.meta.size").value(50))
                .andExpect(jsonPath("$.meta.totalItems").value(51));

        ArgumentCaptor<NotificationQuery> query = ArgumentCaptor.forClass(NotificationQuery.class);
        verify(notificationService).list(eq(alice), query.capture());
        assertThat(query.getValue().getType()).isEqualTo(NotificationType.LIKE);
        assertThat(query.getValue().getStatus()).isEqualTo(NotificationStatus.UNREAD);
        assertThat(query.getValue().isIncludeExpired()).isTrue();
        assertThat(query.getValue().getPage()).isEqualTo(1);
        assertThat(query.getValue().getSize()).isEqualTo(50);
        assertThat(query.getValue().getSortBy()).isEqualTo("readAt");
        assertThat(query.getValue().getSortDirection()).isEqualTo("asc");
    }

    @Test
    void listDefaultsToNewestFirst() throws Exception {
        when(notificationService.list(eq(alice), any(NotificationQuery.class)))
                .thenReturn(new PageImpl<>(List.of(), PageRequest.of(0, 20), 0));

        mockMvc.perform(get("/notifications")).andExpect(status().isOk());

        ArgumentCaptor<NotificationQuery> query = ArgumentCaptor.forClass(NotificationQuery.class);
        verify(notificationService).list(eq(alice), query.capture());
        assertThat(query.getValue().getSize()).isEqualTo(20);
        assertThat(query.getValue().getSortBy()).isEqualTo("createdAt");
        assertThat(query.getValue().getSortDirection()).isEqualTo("desc");
        assertThat(query.getValue().isIncludeExpired()).isFalse();
    }

    @Test
    void archiveReturnsTheUpdatedNotification() throws Exception {
        NotificationResponse archived = notification(NotificationType.COMMENT, NotificationStatus.ARCHIVED);
        when(notificationService.archive(alice, archived.getId())).thenReturn(archived);

        mockMvc.perform(patch("/notifications/{id}/archive", archived.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("ARCHIVED"))
                .andExpect(jsonPath("$.data.id").value(archived.getId().toString()));
    }

    @Test
    void readAllParsesAnIsoCutoff() throws Exception {
        Instant cutoff = Instant.parse("2025-02-28T00:00:00Z");
        when(notificationService.markAllAsRead(alice, NotificationType.COMMENT, cutoff)).thenReturn(3);

        mockMvc.perform(patch("/notifications/read-all")
                        .param("type", "COMMENT")
                        .param("olderThan", "2025-02-28T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.updated").value(3));
    }

    @Test
    void unreadCountIsWrappedInTheEnvelope() throws Exception {
        when(notificationService.unreadCount(alice)).thenReturn(7L);

        mockMvc.perform(get("/notifications/unread-count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("OK"))
                .andExpect(jsonPath("$.timestamp").exists())
                .andExpect(jsonPath("$.data.count").value(7));
    }

    @Test
    void likeEventCreatesANotification() throws Exception {
        UUID postId = UUID.randomUUID();
        UUID bob = UUID.randomUUID();
        NotificationResponse like = notification(NotificationType.LIKE, NotificationStatus.UNREAD);
        when(notificationService.notifyLike(alice.getId(), postId, bob)).thenReturn(Optional.of(like));

        mockMvc.perform(post("/notifications/like")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientId\":\"" + alice.getId() + "\",\"triggerUserId\":\"" + bob
                                + "\",\"postId\":\"" + postId + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Notification created"))
                .andExpect(jsonPath("$.data.title").value("New Like"));
    }

    @Test
    void selfFollowIsSuppressedWithNoContent() throws Exception {
        when(notificationService.notifyFollow(alice.getId(), alice.getId())).thenReturn(Optional.empty());

        mockMvc.perform(post("/notifications/follow")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientId\":\"" + alice.getId() + "\",\"triggerUserId\":\"" + alice.getId() + "\"}"))
                .andExpect(status().isNoContent());
    }

    @Test
    void commentEventWithoutCommentIdIsRejected() throws Exception {
        mockMvc.perform(post("/notifications/comment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientId\":\"" + alice.getId() + "\",\"triggerUserId\":\"" + UUID.randomUUID()
                                + "\",\"postId\":\"" + UUID.randomUUID() + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("commentId is required."));

        verifyNoInteractions(notificationService);
    }

    @Test
    void archivedCleanupUsesDaysOldAndTheControllerClock() throws Exception {
        when(notificationService.cleanupArchivedOlderThan(30, NOW)).thenReturn(12);

        mockMvc.perform(delete("/notifications/archived").param("daysOld", "30"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.deleted").value(12));
    }
}
