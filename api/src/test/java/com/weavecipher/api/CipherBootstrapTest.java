package com.weavecipher.api;

import com.weavecipher.common.CharacterDomain;
import com.weavecipher.common.CipherKey;
import com.weavecipher.config.CipherConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CipherBootstrapTest {

    @Test
    void wiresAllComponents() {
        CipherBootstrap.Components c = CipherBootstrap.init(new CipherConfig());
        assertNotNull(c.config);
        assertNotNull(c.registry);
        assertNotNull(c.transformService);
        assertNotNull(c.streamTransformer);
        assertNotNull(c.fileTransformer);
        assertEquals(CipherKey.defaultSecondKey(), c.transformService.getDefaultKey2());
    }

    @Test
    void transformsAreMeteredWhenEnabled() {
        CipherBootstrap.Components c = CipherBootstrap.init(new CipherConfig());
        c.transformService.encode(CharacterDomain.toCodes("meter me"), CipherKey.of("k"));
        assertNotNull(c.registry.find("weavecipher.transform.duration").timer());
    }

    @Test
    void nullConfigRejected() {
        assertThrows(NullPointerException.class, () -> CipherBootstrap.init(null));
    }
}
