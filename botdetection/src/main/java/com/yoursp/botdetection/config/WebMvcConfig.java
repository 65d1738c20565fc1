package com.yoursp.botdetection.config;

import com.yoursp.botdetection.modules.linktoken.LinkTokenInterceptor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the {@link LinkTokenInterceptor} so rendered pages can link the
 * token stylesheet.
 */
@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

    private final LinkTokenInterceptor linkTokenInterceptor;

    @Override
    public void addInterceptors(@NonNull InterceptorRegistry registry) {
        registry.addInterceptor(linkTokenInterceptor)
                .addPathPatterns("/**")
                .excludePathPatterns("/client*.css", "/actuator/**");
    }
}
