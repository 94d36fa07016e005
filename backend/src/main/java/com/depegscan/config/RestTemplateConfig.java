package com.depegscan.config;

import com.depegscan.common.RateLimiter;
import com.depegscan.common.RetryPolicy;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class RestTemplateConfig {

    @Bean
    @Qualifier("graphqlRestTemplate")
    public RestTemplate graphqlRestTemplate(AppProps props) {
        AppProps.Api api = props.getApi();
        return buildRestTemplate(api.getConnectTimeoutSec(), api.getReadTimeoutSec(), api.getUserAgent());
    }

    /** One limiter for the whole process: every GraphQL call goes through it. */
    @Bean
    public RateLimiter graphqlRateLimiter(AppProps props) {
        return RateLimiter.withMinInterval(props.getApi().getRequestDelayMs());
    }

    @Bean
    public RetryPolicy graphqlRetryPolicy(AppProps props) {
        AppProps.Retry r = props.getApi().getRetry();
        return new RetryPolicy(r.getBaseDelayMs(), r.getJitterFactor(), r.getMaxAttempts());
    }

    private RestTemplate buildRestTemplate(int connectTimeoutSec, int readTimeoutSec, String userAgent) {
        RequestConfig rc = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofSeconds(connectTimeoutSec))
                .setConnectTimeout(Timeout.ofSeconds(connectTimeoutSec))
                .setResponseTimeout(Timeout.ofSeconds(readTimeoutSec))
                .build();
        CloseableHttpClient httpClient = HttpClients.custom()
                .setDefaultRequestConfig(rc)
                .build();
        HttpComponentsClientHttpRequestFactory f = new HttpComponentsClientHttpRequestFactory(httpClient);
        f.setConnectTimeout(connectTimeoutSec * 1000);

        RestTemplate rt = new RestTemplate(f);
        rt.getInterceptors().add((request, body, execution) -> {
            HttpHeaders h = request.getHeaders();
            h.set(HttpHeaders.USER_AGENT, userAgent);
            return execution.execute(request, body);
        });
        return rt;
    }
}
