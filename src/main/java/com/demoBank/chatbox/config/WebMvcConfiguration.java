package com.demoBank.chatbox.config;

import com.demoBank.chatbox.admin.AdminAuthInterceptor;
import com.demoBank.chatbox.auth.UserAuthInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Puts the admin routes behind {@link AdminAuthInterceptor} and the user routes behind {@link UserAuthInterceptor}.
 */
@Configuration
public class WebMvcConfiguration implements WebMvcConfigurer {

    private final AdminAuthInterceptor adminAuthInterceptor;
    private final UserAuthInterceptor userAuthInterceptor;
    private final ChatboxProperties properties;

    public WebMvcConfiguration(AdminAuthInterceptor adminAuthInterceptor, UserAuthInterceptor userAuthInterceptor,
                               ChatboxProperties properties) {
        this.adminAuthInterceptor = adminAuthInterceptor;
        this.userAuthInterceptor = userAuthInterceptor;
        this.properties = properties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(adminAuthInterceptor)
                .addPathPatterns(properties.getPathPrefix() + "/admin/**");
        registry.addInterceptor(userAuthInterceptor)
                .addPathPatterns(properties.getPathPrefix() + "/sessions");
    }
}
