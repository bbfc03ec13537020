package com.ryuqq.tenantguard.core.model;

/**
 * 테넌트(독립 설정된 봇 아이덴티티)의 식별자.
 *
 * <p>TenantId는 레이트 리밋 버킷 키, 서킷 브레이커, 헬스 메트릭, 세션 슬롯을
 * 테넌트 단위로 분리하는 기준으로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * <p>콜론(:)은 버킷 키 구분자로 예약되어 있어 허용하지 않습니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class TenantId implements Comparable<TenantId> {

    private static final int MAX_LENGTH = 128;

    private final String value;

    private TenantId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("TenantId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("TenantId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException(
                "TenantId contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed"
            );
        }
        this.value = value;
    }

    /**
     * TenantId 생성.
     *
     * @param value TenantId 값
     * @return TenantId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static TenantId of(String value) {
        return new TenantId(value);
    }

    /**
     * 숫자형 사용자 ID로부터 TenantId 생성.
     *
     * @param userId 사용자 ID
     * @return TenantId 인스턴스
     */
    public static TenantId of(long userId) {
        return new TenantId(Long.toString(userId));
    }

    /**
     * TenantId 값 조회.
     *
     * @return TenantId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(TenantId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TenantId tenantId = (TenantId) o;
        return value.equals(tenantId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "TenantId{" + value + '}';
    }
}
