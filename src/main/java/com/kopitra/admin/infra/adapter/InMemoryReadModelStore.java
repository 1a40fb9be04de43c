package com.kopitra.admin.infra.adapter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <h1>記憶體讀取模型儲存</h1>
 * <p>
 * 以 (tenantId, businessId) 為鍵保存讀取模型，列表依首次寫入順序回傳。每個租戶各自加鎖，不同租戶之間互不阻塞。
 * </p>
 *
 * @param <T> 讀取模型類型
 */
public abstract class InMemoryReadModelStore<T> {

	private final Map<String, Map<String, T>> tenants = new ConcurrentHashMap<>();

	protected abstract String tenantIdOf(T model);

	protected abstract String businessIdOf(T model);

	protected Optional<T> find(String tenantId, String businessId) {
		Map<String, T> rows = tenants.get(tenantId);
		if (rows == null) {
			return Optional.empty();
		}
		synchronized (rows) {
			return Optional.ofNullable(rows.get(businessId));
		}
	}

	protected List<T> findAll(String tenantId) {
		Map<String, T> rows = tenants.get(tenantId);
		if (rows == null) {
			return List.of();
		}
		synchronized (rows) {
			return List.copyOf(rows.values());
		}
	}

	protected void save(T model) {
		Map<String, T> rows = tenants.computeIfAbsent(tenantIdOf(model), k -> new LinkedHashMap<>());
		synchronized (rows) {
			rows.put(businessIdOf(model), model);
		}
	}

	protected void delete(String tenantId, String businessId) {
		Map<String, T> rows = tenants.get(tenantId);
		if (rows != null) {
			synchronized (rows) {
				rows.remove(businessId);
			}
		}
	}

	protected void deleteAll() {
		tenants.clear();
	}
}
