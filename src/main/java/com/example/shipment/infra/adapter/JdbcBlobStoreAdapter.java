package com.example.shipment.infra.adapter;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import com.example.shipment.application.port.BlobStorePort;
import com.example.shipment.application.shared.exception.StorageUnavailableException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 以關聯式資料庫實作的 Blob 儲存轉接器
 *
 * <p>
 * 每個 container 對應一張資料表 {@code blob_<container>}，於第一次存取時以
 * {@code CREATE TABLE IF NOT EXISTS} 建立。同一個 key 只保留一筆紀錄，寫入採用 Upsert (後寫者勝)。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcBlobStoreAdapter implements BlobStorePort {

	/**
	 * container 名稱會組進 SQL 表名，只允許小寫英數與底線
	 */
	private static final Pattern CONTAINER_NAME = Pattern.compile("[a-z0-9_]{1,48}");

	private final JdbcTemplate jdbcTemplate;

	/**
	 * 已確認存在的 container
	 */
	private final Set<String> provisioned = ConcurrentHashMap.newKeySet();

	@Override
	public Optional<byte[]> get(String container, String key) {
		String table = ensureContainer(container);
		try {
			List<byte[]> rows = jdbcTemplate.query("SELECT content FROM " + table + " WHERE blob_key = ?",
					(rs, rowNum) -> rs.getBytes("content"), key);
			return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
		} catch (DataAccessException e) {
			throw new StorageUnavailableException("Blob 讀取失敗: " + container + "/" + key, e);
		}
	}

	@Override
	public void put(String container, String key, byte[] content) {
		String table = ensureContainer(container);
		String sql = "INSERT INTO " + table + " (blob_key, content, updated_at) VALUES (?, ?, CURRENT_TIMESTAMP) "
				+ "ON DUPLICATE KEY UPDATE content = VALUES(content), updated_at = CURRENT_TIMESTAMP";
		try {
			jdbcTemplate.update(sql, key, content);
			log.debug("[Blob] 已寫入 {}/{} ({} bytes)", container, key, content.length);
		} catch (DataAccessException e) {
			throw new StorageUnavailableException("Blob 寫入失敗: " + container + "/" + key, e);
		}
	}

	/**
	 * 延遲建立 container 對應的資料表
	 *
	 * @return 資料表名稱
	 */
	private String ensureContainer(String container) {
		if (container == null || !CONTAINER_NAME.matcher(container).matches()) {
			throw new IllegalArgumentException("不合法的 container 名稱: " + container);
		}
		String table = "blob_" + container;
		if (provisioned.contains(container)) {
			return table;
		}
		String ddl = """
				CREATE TABLE IF NOT EXISTS %s (
				    blob_key VARCHAR(512) NOT NULL PRIMARY KEY,
				    content LONGBLOB NOT NULL,
				    updated_at TIMESTAMP NOT NULL
				)
				""".formatted(table);
		try {
			jdbcTemplate.execute(ddl);
		} catch (DataAccessException e) {
			throw new StorageUnavailableException("Blob container 建立失敗: " + container, e);
		}
		provisioned.add(container);
		log.info(">>> [Blob] container {} 已就緒 (table: {})", container, table);
		return table;
	}
}
