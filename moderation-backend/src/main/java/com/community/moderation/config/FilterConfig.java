package com.community.moderation.config;

import com.community.moderation.filter.PrincipalFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FilterConfig {

    @Bean
    public FilterRegistrationBean<PrincipalFilter> principalFilterBean(PrincipalFilter principalFilter) {
        FilterRegistrationBean<PrincipalFilter> registrationBean = new FilterRegistrationBean<>(principalFilter);

        // 只拦截审核接口
        registrationBean.addUrlPatterns("/moderation/*");
        registrationBean.setOrder(1);

        return registrationBean;
    }
}
