package com.example.shipment.application.port;

import java.util.Optional;

/**
 * 二進位物件儲存埠 (Blob Store Port)
 *
 * <p>
 * 以 container + key 定位一份 byte[]，同一個 key 只保留最後一次寫入的內容。 container 於第一次存取時自動建立。
 * </p>
 */
public interface BlobStorePort {

	/**
	 * @return 物件內容，不存在時回傳 Optional.empty()
	 */
	Optional<byte[]> get(String container, String key);

	/**
	 * 寫入 (覆蓋) 物件內容
	 */
	void put(String container, String key, byte[] content);
}
