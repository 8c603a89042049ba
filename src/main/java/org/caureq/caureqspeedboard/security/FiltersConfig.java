package org.caureq.caureqspeedboard.security;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FiltersConfig {

    /** The container matches these against the decoded, normalized request path. */
    @Bean
    public FilterRegistrationBean<TokenFilter> tokenFilterRegistration(TokenFilter f) {
        var reg = new FilterRegistrationBean<>(f);
        reg.setOrder(10);
        for (var path : TokenFilter.PROTECTED) {
            reg.addUrlPatterns(path, path + "/*");
        }
        return reg;
    }
}
