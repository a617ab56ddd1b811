package com.tessera.authservice.api;

import com.tessera.authservice.keys.KeyMaterialLoader;
import com.tessera.authservice.keys.KeyReloadResult;
import com.tessera.authservice.security.AccessGuard;
import com.tessera.security.Principal;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoint that re-reads key material after a rotation.
 */
@RestController
@RequestMapping("/admin/v1/keys")
public class KeyAdminController {

    static final String ROTATE_ACTION = "keys:rotate";
    static final String KEYS_RESOURCE = "keys";

    private static final Logger log = LoggerFactory.getLogger(KeyAdminController.class);

    private final AccessGuard guard;
    private final KeyMaterialLoader loader;

    public KeyAdminController(AccessGuard guard, KeyMaterialLoader loader) {
        this.guard = guard;
        this.loader = loader;
    }

    @PostMapping("/reload")
    public KeyReloadResult reload(HttpServletRequest request) {
        Principal operator = guard.require(request, ROTATE_ACTION, KEYS_RESOURCE);
        log.info("Key reload requested by sub={}", operator.subjectId());
        return loader.reload();
    }
}
