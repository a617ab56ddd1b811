package com.tessera.authservice.api;

import com.tessera.authservice.security.CredentialAuthenticator;
import com.tessera.security.PolicyDocument;
import com.tessera.security.PolicyDocumentParser;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Authoring-time validation of policy documents. Invalid documents are answered with every
 * error found, through {@link com.tessera.authservice.web.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/policy-documents")
public class PolicyDocumentController {

    private final CredentialAuthenticator authenticator;

    public PolicyDocumentController(CredentialAuthenticator authenticator) {
        this.authenticator = authenticator;
    }

    @PostMapping(path = "/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> validate(HttpServletRequest request, @RequestBody String document) {
        authenticator.authenticate(request);
        PolicyDocument parsed = PolicyDocumentParser.parse(document);
        return Map.of(
                "valid", true,
                "version", parsed.version(),
                "statements", parsed.statements().size());
    }
}
