package com.dcruver.itemstore.protect;

import javax.crypto.SecretKey;

/**
 * Supplies the AES key used to protect sensitive content.
 */
public interface KeyMaterialProvider {

    SecretKey currentKey();
}
