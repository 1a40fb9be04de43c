package com.kopitra.admin.application.domain.adminuser.aggregate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.kopitra.admin.application.domain.adminuser.aggregate.vo.AdminUserRole;
import com.kopitra.admin.application.domain.adminuser.event.AdminUserEvent;
import com.kopitra.admin.application.domain.adminuser.event.AdminUserNotificationSettingsUpdated;
import com.kopitra.admin.application.domain.adminuser.event.AdminUserProvisioned;
import com.kopitra.admin.application.domain.adminuser.event.AdminUserRolesUpdated;
import com.kopitra.admin.application.domain.shared.AggregateRoot;
import com.kopitra.admin.application.domain.shared.DeterministicIds;
import com.kopitra.admin.application.domain.shared.exception.DomainValidationException;

/**
 * <h1>管理者帳號聚合 (AdminUser)</h1>
 * <ul>
 * <li>同一租戶下的 userId 只能開通一次。</li>
 * <li>角色集合相同時不產生事件。</li>
 * <li>通知主題會去除空白、忽略空字串，且不分大小寫去重。</li>
 * </ul>
 */
public class AdminUser extends AggregateRoot<AdminUserState, AdminUserEvent> {

	public static final String ID_SCOPE = "adminuser";

	public AdminUser(String id) {
		super(id, AdminUserState.EMPTY);
	}

	public static String idFor(String tenantId, String userId) {
		return DeterministicIds.derive(ID_SCOPE, tenantId, userId);
	}

	public void provision(String tenantId, String userId, String email, String displayName,
			Collection<AdminUserRole> roles, Instant provisionedAt, String provisionedBy) {
		if (getState().provisioned()) {
			throw new DomainValidationException("管理者 " + userId + " 已存在");
		}
		emit(new AdminUserProvisioned(tenantId, userId, email, displayName, distinct(roles), provisionedAt,
				provisionedBy));
	}

	public void updateRoles(Collection<AdminUserRole> roles, Instant updatedAt, String updatedBy) {
		requireProvisioned();
		List<AdminUserRole> next = distinct(roles);
		if (new HashSet<>(next).equals(new HashSet<>(getState().roles()))) {
			return;
		}
		emit(new AdminUserRolesUpdated(getState().tenantId(), getState().userId(), next, updatedAt, updatedBy));
	}

	public void updateNotificationSettings(boolean emailEnabled, Collection<String> topics, Instant updatedAt,
			String updatedBy) {
		requireProvisioned();
		List<String> next = normalizeTopics(topics);
		if (getState().emailEnabled() == emailEnabled && sameTopics(next, getState().topics())) {
			return;
		}
		emit(new AdminUserNotificationSettingsUpdated(getState().tenantId(), getState().userId(), emailEnabled, next,
				updatedAt, updatedBy));
	}

	@Override
	protected AdminUserState apply(AdminUserState state, AdminUserEvent event) {
		if (event instanceof AdminUserProvisioned e) {
			return new AdminUserState(e.tenantId(), e.userId(), e.email(), e.displayName(), e.roles(), false,
					List.of());
		}
		if (event instanceof AdminUserRolesUpdated e) {
			return new AdminUserState(state.tenantId(), state.userId(), state.email(), state.displayName(), e.roles(),
					state.emailEnabled(), state.topics());
		}
		if (event instanceof AdminUserNotificationSettingsUpdated e) {
			return new AdminUserState(state.tenantId(), state.userId(), state.email(), state.displayName(),
					state.roles(), e.emailEnabled(), e.topics());
		}
		throw new IllegalArgumentException("未知事件類型: " + event.getClass().getSimpleName());
	}

	@Override
	protected Class<AdminUserEvent> eventType() {
		return AdminUserEvent.class;
	}

	private void requireProvisioned() {
		if (!getState().provisioned()) {
			throw new DomainValidationException("管理者 " + getId() + " 尚未開通");
		}
	}

	private static List<AdminUserRole> distinct(Collection<AdminUserRole> roles) {
		if (roles == null || roles.isEmpty()) {
			return List.of();
		}
		return List.copyOf(EnumSet.copyOf(roles));
	}

	static List<String> normalizeTopics(Collection<String> topics) {
		if (topics == null) {
			return List.of();
		}
		Map<String, String> unique = new LinkedHashMap<>();
		for (String topic : topics) {
			if (topic == null) {
				continue;
			}
			String trimmed = topic.trim();
			if (!trimmed.isEmpty()) {
				unique.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
			}
		}
		return new ArrayList<>(unique.values());
	}

	private static boolean sameTopics(List<String> left, List<String> right) {
		return lowerCased(left).equals(lowerCased(right));
	}

	private static Set<String> lowerCased(List<String> topics) {
		Set<String> result = new HashSet<>();
		topics.forEach(t -> result.add(t.toLowerCase(Locale.ROOT)));
		return result;
	}
}
