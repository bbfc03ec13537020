/**
 * 관리 계층용 조회/조치 API.
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
package com.ryuqq.tenantguard.application.admin;
