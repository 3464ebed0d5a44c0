package github.sarthakdev143.hdr_studio.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;

@Configuration
@EnableConfigurationProperties(HdrStudioProperties.class)
public class HttpClientConfig {

    @Bean
    public RestClient sourceImageRestClient(HdrStudioProperties properties) {
        return buildSourceImageRestClient(properties.fetch());
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    public static RestClient buildSourceImageRestClient(HdrStudioProperties.Fetch fetch) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(fetch.connectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(fetch.readTimeout());
        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }
}
