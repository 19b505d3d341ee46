package com.clan.clears.config;

import com.clan.clears.filter.AdminTokenFilter;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FilterConfig {

    @Bean
    public FilterRegistrationBean<AdminTokenFilter> adminTokenFilterBean(AdminTokenFilter adminTokenFilter) {
        FilterRegistrationBean<AdminTokenFilter> registrationBean =
                new FilterRegistrationBean<>(adminTokenFilter);

        // 只保护管理员刷新接口
        registrationBean.addUrlPatterns("/run-update");
        registrationBean.setOrder(1);

        return registrationBean;
    }
}
