package com.yoursp.botdetection.modules.linktoken;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/**
 * Serves {@code /client<token>.css}, the stylesheet every rendered page links
 * to. The answer is always an empty stylesheet, whatever the token, so a client
 * learns nothing about the validity check.
 */
@RestController
@RequiredArgsConstructor
public class ClientTokenController {

    static final String STYLESHEET_PREFIX = "/client";
    static final String STYLESHEET_SUFFIX = ".css";
    private static final MediaType TEXT_CSS = MediaType.valueOf("text/css");

    private final LinkTokenService linkTokenService;

    @RequestMapping(value = STYLESHEET_PREFIX + "{token}" + STYLESHEET_SUFFIX,
            method = { RequestMethod.GET, RequestMethod.POST })
    public ResponseEntity<String> clientToken(@PathVariable("token") String token, HttpServletRequest request) {
        linkTokenService.ping(request, token);
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .contentType(TEXT_CSS)
                .body("");
    }

    /**
     * @return the path a page links to for {@code token}
     */
    public static String stylesheetPath(String token) {
        return STYLESHEET_PREFIX + token + STYLESHEET_SUFFIX;
    }
}
