package tech.cids.platform.token;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TokenCleanupSchedulerTest {

    @Mock
    TokenService tokenService;

    @InjectMocks
    TokenCleanupScheduler scheduler;

    @Test
    void cleanupExpiredTokens_shouldSurviveFailure() {
        when(tokenService.cleanupExpired())
            .thenThrow(new IllegalStateException("database down"))
            .thenReturn(new CleanupResult(1, 0));

        assertThatCode(scheduler::cleanupExpiredTokens).doesNotThrowAnyException();
        scheduler.cleanupExpiredTokens();

        verify(tokenService, times(2)).cleanupExpired();
    }

    @Test
    void cleanupExpiredTokens_shouldStopAfterShutdown() {
        scheduler.onShutdown();

        scheduler.cleanupExpiredTokens();

        verifyNoInteractions(tokenService);
    }
}
