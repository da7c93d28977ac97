package com.vertector.nats.connection;

import com.vertector.nats.config.ConnectionSettings;
import org.springframework.boot.ssl.SslBundle;
import org.springframework.boot.ssl.pem.PemSslStoreBundle;
import org.springframework.boot.ssl.pem.PemSslStoreDetails;

import javax.net.ssl.SSLContext;
import java.nio.file.Path;

/**
 * Builds an {@link SSLContext} from PEM files through a Spring Boot {@link SslBundle}.
 *
 * <ul>
 *   <li>CA file: one or more X.509 certificates trusted for the server. Without one the
 *       JDK default trust store applies.</li>
 *   <li>Client certificate and private key: mutual TLS, only when both are configured.
 *       PKCS#1, PKCS#8 and SEC1 (EC) keys are accepted.</li>
 * </ul>
 */
final class TlsContextFactory {

    private TlsContextFactory() {
    }

    /** @throws IllegalStateException if a PEM file cannot be read or parsed */
    static SSLContext create(ConnectionSettings.Tls tls) {
        PemSslStoreDetails trust = tls.caFile() == null
                ? null
                : PemSslStoreDetails.forCertificates(location(tls.caFile()));
        PemSslStoreDetails key = tls.mutual()
                ? PemSslStoreDetails.forCertificates(location(tls.certFile())).withPrivateKey(location(tls.keyFile()))
                : null;
        return SslBundle.of(new PemSslStoreBundle(key, trust)).createSslContext();
    }

    private static String location(Path file) {
        return file.toAbsolutePath().toUri().toString();
    }
}
