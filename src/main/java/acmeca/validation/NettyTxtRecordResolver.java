package acmeca.validation;

import io.netty.buffer.ByteBuf;
import io.netty.handler.codec.dns.DefaultDnsQuestion;
import io.netty.handler.codec.dns.DnsRawRecord;
import io.netty.handler.codec.dns.DnsRecord;
import io.netty.handler.codec.dns.DnsRecordType;
import io.netty.resolver.dns.DnsNameResolver;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.Future;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Resolves TXT records with Netty's asynchronous resolver, the one Reactor Netty uses for its own lookups.
 */
@Component
@Slf4j
public class NettyTxtRecordResolver implements TxtRecordResolver {

    private final DnsNameResolver dnsNameResolver;

    public NettyTxtRecordResolver(DnsNameResolver dnsNameResolver) {
        this.dnsNameResolver = dnsNameResolver;
    }

    @Override
    public Mono<List<String>> resolveTxt(String name) {
        log.debug("Resolving TXT records of name={}", name);
        return Mono.create(sink -> {
            final Future<List<DnsRecord>> lookup =
                dnsNameResolver.resolveAll(new DefaultDnsQuestion(name, DnsRecordType.TXT));
            sink.onCancel(() -> lookup.cancel(false));
            lookup.addListener(completed -> {
                if (!lookup.isSuccess()) {
                    sink.error(lookup.cause());
                    return;
                }
                final List<DnsRecord> records = lookup.getNow();
                try {
                    sink.success(toStrings(records));
                } finally {
                    records.forEach(ReferenceCountUtil::release);
                }
            });
        });
    }

    /**
     * A TXT record is a sequence of length-prefixed character strings, RFC 1035 Sec 3.3.14.
     */
    static List<String> toStrings(List<DnsRecord> records) {
        final List<String> values = new ArrayList<>();
        for (DnsRecord record : records) {
            if (record.type() != DnsRecordType.TXT || !(record instanceof DnsRawRecord raw)) {
                continue;
            }
            final ByteBuf content = raw.content().duplicate();
            final StringBuilder value = new StringBuilder();
            while (content.isReadable()) {
                final int length = content.readUnsignedByte();
                value.append(content.readCharSequence(Math.min(length, content.readableBytes()), StandardCharsets.UTF_8));
            }
            values.add(value.toString());
        }
        return values;
    }
}
