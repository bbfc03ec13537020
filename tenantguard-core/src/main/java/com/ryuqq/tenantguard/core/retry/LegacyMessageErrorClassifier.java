package com.ryuqq.tenantguard.core.retry;

import com.ryuqq.tenantguard.core.exception.ErrorCategory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 타입 정보가 없는 레거시 오류용 메시지 기반 분류기.
 *
 * <p>먼저 {@link TypedErrorClassifier}로 분류하고, 결과가 UNKNOWN일 때만 cause 체인의
 * 예외 클래스 이름과 메시지를 소문자로 바꿔 부분 문자열로 판별합니다.
 * 판별 순서는 RATE_LIMITED, PERMANENT, TRANSIENT_NETWORK 입니다.</p>
 *
 * <p>대기 힌트는 {@code FLOOD_WAIT_30}, {@code retry after 30}, {@code retry_after=30},
 * {@code wait of 30 seconds} 형태에서 초 단위로 추출합니다.</p>
 *
 * <p>새 업스트림 클라이언트는 타입이 있는 예외를 던지고 {@link TypedErrorClassifier}를 사용해야 합니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public class LegacyMessageErrorClassifier implements ErrorClassifier {

    private static final List<String> RATE_LIMITED_MARKERS = List.of(
        "429", "too many requests", "flood", "rate limit", "ratelimit", "retry after", "slowmode"
    );

    private static final List<String> PERMANENT_MARKERS = List.of(
        "401", "403", "unauthorized", "forbidden", "banned", "deactivated", "invalid token", "auth key"
    );

    private static final List<String> TRANSIENT_MARKERS = List.of(
        "timeout", "timed out", "connection", "network", "502", "503", "504", "temporarily unavailable"
    );

    private static final List<Pattern> WAIT_HINT_PATTERNS = List.of(
        Pattern.compile("flood_wait_(\\d{1,9})"),
        Pattern.compile("retry after (\\d{1,9})"),
        Pattern.compile("retry_after[=: ]+(\\d{1,9})"),
        Pattern.compile("wait of (\\d{1,9}) seconds")
    );

    private final TypedErrorClassifier typed = new TypedErrorClassifier();

    @Override
    public ErrorCategory classify(Throwable error) {
        ErrorCategory category = typed.classify(error);
        if (category != ErrorCategory.UNKNOWN) {
            return category;
        }

        String text = describeChain(error);
        if (containsAny(text, RATE_LIMITED_MARKERS)) {
            return ErrorCategory.RATE_LIMITED;
        }
        if (containsAny(text, PERMANENT_MARKERS)) {
            return ErrorCategory.PERMANENT;
        }
        if (containsAny(text, TRANSIENT_MARKERS)) {
            return ErrorCategory.TRANSIENT_NETWORK;
        }
        return ErrorCategory.UNKNOWN;
    }

    @Override
    public Optional<Duration> waitHint(Throwable error) {
        Optional<Duration> typedHint = ErrorClassifier.super.waitHint(error);
        if (typedHint.isPresent()) {
            return typedHint;
        }

        String text = describeChain(error);
        for (Pattern pattern : WAIT_HINT_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(Duration.ofSeconds(Long.parseLong(matcher.group(1))));
            }
        }
        return Optional.empty();
    }

    private static boolean containsAny(String text, List<String> markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static String describeChain(Throwable error) {
        StringBuilder builder = new StringBuilder();
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < TypedErrorClassifier.MAX_CAUSE_DEPTH) {
            builder.append(current.getClass().getSimpleName()).append(' ');
            if (current.getMessage() != null) {
                builder.append(current.getMessage()).append(' ');
            }
            current = current.getCause();
            depth++;
        }
        return builder.toString().toLowerCase(Locale.ROOT);
    }
}
