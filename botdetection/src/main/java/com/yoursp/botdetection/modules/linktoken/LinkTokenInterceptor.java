package com.yoursp.botdetection.modules.linktoken;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.ModelAndView;

/**
 * Adds the current link token to every rendered view.
 * <p>
 * Templates link the stylesheet with
 * {@code <link rel="stylesheet" href="${linkTokenUrl}" type="text/css">}.
 * {@code @ResponseBody} handlers have no {@link ModelAndView} and are skipped,
 * as are redirects.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class LinkTokenInterceptor implements HandlerInterceptor {

    public static final String LINK_TOKEN_ATTRIBUTE = "linkToken";
    public static final String LINK_TOKEN_URL_ATTRIBUTE = "linkTokenUrl";

    private final TokenService tokenService;

    @Override
    public void postHandle(@NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull Object handler,
            @Nullable ModelAndView modelAndView) {
        if (modelAndView == null) {
            return;
        }
        String viewName = modelAndView.getViewName();
        if (viewName != null && viewName.startsWith("redirect:")) {
            return;
        }

        String token = tokenService.currentToken();
        modelAndView.addObject(LINK_TOKEN_ATTRIBUTE, token);
        modelAndView.addObject(LINK_TOKEN_URL_ATTRIBUTE,
                request.getContextPath() + ClientTokenController.stylesheetPath(token));
    }
}
