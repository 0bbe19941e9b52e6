package acmeca.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.netty.resolver.dns.DnsNameResolver;
import io.netty.resolver.dns.NoopDnsCache;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:dns-resolver;DB_CLOSE_DELAY=-1")
class DnsResolverConfigTest {

    @Autowired
    DnsNameResolver dnsNameResolver;

    @Autowired
    AppProperties appProperties;

    @Test
    void resolverDoesNotCacheRecords() {
        assertThat(dnsNameResolver.resolveCache()).isSameAs(NoopDnsCache.INSTANCE);
        assertThat(dnsNameResolver.queryTimeoutMillis())
            .isEqualTo(appProperties.validation().attemptTimeout().toMillis());
    }
}
