package org.burrow.rabbit.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Builds an {@link SSLContext} from the first file found in a keys directory.
 *
 * <p>Key stores ({@code .p12}, {@code .pfx}, {@code .jks}) are used as client key material
 * with an empty password. Any other file is read as X.509 certificates that become the
 * only trusted issuers for the broker.</p>
 *
 * <p>Host name verification stays disabled on the resulting connections, so a broker
 * certificate whose name does not match the URI host is accepted.</p>
 */
public final class TlsSupport {

    private static final Logger log = LoggerFactory.getLogger(TlsSupport.class);

    private static final char[] EMPTY_PASSWORD = new char[0];

    private TlsSupport() {
    }

    /**
     * @param keysPath directory to scan, may be null
     * @return a TLS context, or empty when there is no directory or it holds no file
     * @throws TransportException if the file cannot be read as key or certificate material
     */
    public static Optional<SSLContext> fromKeysDirectory(Path keysPath) {
        return firstFile(keysPath).map(TlsSupport::createContext);
    }

    static Optional<Path> firstFile(Path keysPath) {
        if (keysPath == null || !Files.isDirectory(keysPath)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(keysPath)) {
            return files.filter(Files::isRegularFile).sorted().findFirst();
        } catch (IOException e) {
            throw new TransportException("Cannot list keys directory " + keysPath, e);
        }
    }

    static SSLContext createContext(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            if (name.endsWith(".p12") || name.endsWith(".pfx") || name.endsWith(".jks")) {
                KeyStore keyStore = KeyStore.getInstance(name.endsWith(".jks") ? "JKS" : "PKCS12");
                try (InputStream in = Files.newInputStream(file)) {
                    keyStore.load(in, EMPTY_PASSWORD);
                }
                KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
                kmf.init(keyStore, EMPTY_PASSWORD);
                context.init(kmf.getKeyManagers(), null, null);
            } else {
                KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
                trustStore.load(null, null);
                Collection<? extends Certificate> certificates;
                try (InputStream in = Files.newInputStream(file)) {
                    certificates = CertificateFactory.getInstance("X.509").generateCertificates(in);
                }
                int i = 0;
                for (Certificate certificate : certificates) {
                    trustStore.setCertificateEntry("broker-" + i++, certificate);
                }
                TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
                tmf.init(trustStore);
                context.init(null, tmf.getTrustManagers(), null);
            }
            log.info("Using TLS material from {}", file);
            return context;
        } catch (IOException | GeneralSecurityException e) {
            throw new TransportException("Failed to configure TLS from " + file, e);
        }
    }
}
