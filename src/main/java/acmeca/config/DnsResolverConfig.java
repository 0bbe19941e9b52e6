package acmeca.config;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.resolver.dns.DnsNameResolver;
import io.netty.resolver.dns.DnsNameResolverBuilder;
import io.netty.resolver.dns.NoopDnsCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * DNS resolver for dns-01 lookups. Queries go to the resolvers configured for the host.
 */
@Configuration
public class DnsResolverConfig {

    @Bean(destroyMethod = "shutdownGracefully")
    public EventLoopGroup dnsEventLoopGroup() {
        return new NioEventLoopGroup(1);
    }

    @Bean(destroyMethod = "close")
    public DnsNameResolver dnsNameResolver(EventLoopGroup dnsEventLoopGroup, AppProperties appProperties) {
        return new DnsNameResolverBuilder(dnsEventLoopGroup.next())
            .channelType(NioDatagramChannel.class)
            .queryTimeoutMillis(appProperties.validation().attemptTimeout().toMillis())
            // validation must see current records
            .resolveCache(NoopDnsCache.INSTANCE)
            .build();
    }
}
