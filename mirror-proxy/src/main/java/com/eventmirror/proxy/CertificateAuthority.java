package com.eventmirror.proxy;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.util.IPAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Root certificate the proxy signs per-host server certificates with, so it
 * can terminate TLS for the mirror target.
 *
 * <h3>Trust</h3>
 * <p>
 * A device only accepts intercepted connections once this root is trusted:
 * install {@value #PEM_FILE} as a user CA on the emulator or device, and
 * make sure the app's network security configuration trusts user CAs in
 * test builds. Apps that pin their analytics certificate cannot be
 * intercepted at all.
 * </p>
 *
 * <h3>Persistence</h3>
 * <p>
 * {@link #loadOrCreate(Path)} keeps the root key in a PKCS#12 store
 * ({@value #KEYSTORE_FILE}) so the certificate installed on a device stays
 * valid across proxy restarts. {@link #create()} makes a throwaway root for
 * tests.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Safe for concurrent use. Server contexts are issued once per host and
 * cached.
 * </p>
 *
 * @since 1.0.0
 */
public final class CertificateAuthority {

    private static final Logger LOG = LoggerFactory.getLogger(CertificateAuthority.class);

    public static final String KEYSTORE_FILE = "mirror-ca.p12";
    public static final String PEM_FILE = "mirror-ca.pem";

    static final String CA_NAME = "Event Mirror Proxy CA";
    static final Duration CA_VALIDITY = Duration.ofDays(3650);
    static final Duration LEAF_VALIDITY = Duration.ofDays(365);

    private static final String ALIAS = "mirror-ca";
    private static final char[] STORE_PASSWORD = "event-mirror".toCharArray();
    private static final String KEY_ALGORITHM = "RSA";
    private static final int KEY_SIZE = 2048;
    private static final String SIGNATURE_ALGORITHM = "SHA256WithRSA";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final X509Certificate certificate;
    private final PrivateKey privateKey;
    private final KeyPair leafKeys;
    private final Path pemFile;
    private final Map<String, SSLContext> serverContexts = new ConcurrentHashMap<>();

    private CertificateAuthority(X509Certificate certificate, PrivateKey privateKey, Path pemFile) {
        this.certificate = certificate;
        this.privateKey = privateKey;
        this.pemFile = pemFile;
        // one key pair for every leaf; only the certificates differ per host
        this.leafKeys = generateKeyPair();
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    /**
     * @return a new in-memory root, not written anywhere
     */
    public static CertificateAuthority create() {
        KeyPair keys = generateKeyPair();
        return new CertificateAuthority(selfSign(keys), keys.getPrivate(), null);
    }

    /**
     * Load the root kept in {@code dir}, creating and saving one on first use.
     * The PEM export next to it is rewritten every time.
     *
     * @param dir directory holding {@value #KEYSTORE_FILE}
     * @return the loaded or created root
     * @throws IOException if the directory or key store cannot be read or
     *                     written
     */
    public static CertificateAuthority loadOrCreate(Path dir) throws IOException {
        Objects.requireNonNull(dir, "dir must not be null");
        Path store = dir.resolve(KEYSTORE_FILE);
        Path pem = dir.resolve(PEM_FILE);

        X509Certificate certificate;
        PrivateKey key;
        try {
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            if (Files.isRegularFile(store)) {
                try (InputStream in = Files.newInputStream(store)) {
                    keyStore.load(in, STORE_PASSWORD);
                }
                key = (PrivateKey) keyStore.getKey(ALIAS, STORE_PASSWORD);
                certificate = (X509Certificate) keyStore.getCertificate(ALIAS);
                if (key == null || certificate == null) {
                    throw new IOException("Key store " + store + " has no '" + ALIAS + "' entry");
                }
                LOG.info("Loaded proxy CA from {}", store);
            } else {
                KeyPair keys = generateKeyPair();
                certificate = selfSign(keys);
                key = keys.getPrivate();
                keyStore.load(null, null);
                keyStore.setKeyEntry(ALIAS, key, STORE_PASSWORD, new Certificate[] { certificate });
                Files.createDirectories(dir);
                try (OutputStream out = Files.newOutputStream(store)) {
                    keyStore.store(out, STORE_PASSWORD);
                }
                LOG.info("Created proxy CA in {}", store);
            }
        } catch (GeneralSecurityException e) {
            throw new IOException("Cannot use proxy CA key store " + store, e);
        }

        Files.createDirectories(dir);
        try (Writer writer = Files.newBufferedWriter(pem, StandardCharsets.US_ASCII);
             JcaPEMWriter pemWriter = new JcaPEMWriter(writer)) {
            pemWriter.writeObject(certificate);
        }
        return new CertificateAuthority(certificate, key, pem);
    }

    // ---------------------------------------------------------------
    // Issuing
    // ---------------------------------------------------------------

    /**
     * Server-side TLS context presenting a certificate for {@code host},
     * chained to this root.
     *
     * @param host DNS name or IP literal; IPv6 may be bracketed
     * @return cached context for the host
     * @throws IllegalStateException if the certificate cannot be issued
     */
    public SSLContext serverContext(String host) {
        Objects.requireNonNull(host, "host must not be null");
        return serverContexts.computeIfAbsent(normalize(host), this::newServerContext);
    }

    /**
     * Issue a server certificate for {@code host}.
     *
     * @param host DNS name or IP literal
     * @return certificate with {@code host} as its only subject alternative
     *         name
     * @throws IllegalStateException if signing fails
     */
    public X509Certificate issue(String host) {
        String name = normalize(host);
        Instant now = Instant.now();
        try {
            JcaX509ExtensionUtils extensions = new JcaX509ExtensionUtils();
            X500Name subject = new X500NameBuilder(BCStyle.INSTANCE).addRDN(BCStyle.CN, name).build();
            GeneralName altName = IPAddress.isValid(name)
                    ? new GeneralName(GeneralName.iPAddress, name)
                    : new GeneralName(GeneralName.dNSName, name);

            X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(certificate, serial(),
                    Date.from(now.minus(Duration.ofDays(1))), Date.from(now.plus(LEAF_VALIDITY)),
                    subject, leafKeys.getPublic())
                    .addExtension(Extension.basicConstraints, true, new BasicConstraints(false))
                    .addExtension(Extension.keyUsage, true,
                            new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyEncipherment))
                    .addExtension(Extension.extendedKeyUsage, false,
                            new ExtendedKeyUsage(KeyPurposeId.id_kp_serverAuth))
                    .addExtension(Extension.subjectAlternativeName, false, new GeneralNames(altName))
                    .addExtension(Extension.subjectKeyIdentifier, false,
                            extensions.createSubjectKeyIdentifier(leafKeys.getPublic()))
                    .addExtension(Extension.authorityKeyIdentifier, false,
                            extensions.createAuthorityKeyIdentifier(certificate));

            X509Certificate leaf = sign(builder, privateKey);
            LOG.debug("Issued certificate for {}", name);
            return leaf;
        } catch (GeneralSecurityException | CertIOException | OperatorCreationException e) {
            throw new IllegalStateException("Failed to issue certificate for " + name, e);
        }
    }

    /**
     * Client-side TLS context that trusts this root and nothing else. Tests
     * use it in place of a device with the root installed.
     *
     * @throws IllegalStateException if the context cannot be built
     */
    public SSLContext trustingContext() {
        try {
            KeyStore trustStore = KeyStore.getInstance("PKCS12");
            trustStore.load(null, null);
            trustStore.setCertificateEntry(ALIAS, certificate);
            TrustManagerFactory trust = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trust.init(trustStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trust.getTrustManagers(), null);
            return context;
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalStateException("Failed to build trusting TLS context", e);
        }
    }

    public X509Certificate getCertificate() {
        return certificate;
    }

    /**
     * @return the exported root for installing on devices; empty for an
     *         in-memory root
     */
    public Optional<Path> getPemFile() {
        return Optional.ofNullable(pemFile);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private SSLContext newServerContext(String host) {
        X509Certificate leaf = issue(host);
        try {
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(null, null);
            keyStore.setKeyEntry(host, leafKeys.getPrivate(), STORE_PASSWORD, new Certificate[] { leaf, certificate });
            KeyManagerFactory keys = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            keys.init(keyStore, STORE_PASSWORD);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(keys.getKeyManagers(), null, null);
            return context;
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalStateException("Failed to build TLS context for " + host, e);
        }
    }

    private static X509Certificate selfSign(KeyPair keys) {
        Instant now = Instant.now();
        X500Name name = new X500NameBuilder(BCStyle.INSTANCE)
                .addRDN(BCStyle.CN, CA_NAME)
                .addRDN(BCStyle.O, "Event Mirror")
                .build();
        try {
            JcaX509ExtensionUtils extensions = new JcaX509ExtensionUtils();
            X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(name, serial(),
                    Date.from(now.minus(Duration.ofDays(1))), Date.from(now.plus(CA_VALIDITY)),
                    name, keys.getPublic())
                    .addExtension(Extension.basicConstraints, true, new BasicConstraints(true))
                    .addExtension(Extension.keyUsage, true, new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign))
                    .addExtension(Extension.subjectKeyIdentifier, false,
                            extensions.createSubjectKeyIdentifier(keys.getPublic()));
            return sign(builder, keys.getPrivate());
        } catch (GeneralSecurityException | CertIOException | OperatorCreationException e) {
            throw new IllegalStateException("Failed to create proxy CA certificate", e);
        }
    }

    private static X509Certificate sign(X509v3CertificateBuilder builder, PrivateKey signingKey)
            throws OperatorCreationException, GeneralSecurityException {
        ContentSigner signer = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(signingKey);
        return new JcaX509CertificateConverter().getCertificate(builder.build(signer));
    }

    private static KeyPair generateKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(KEY_ALGORITHM);
            generator.initialize(KEY_SIZE, RANDOM);
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("RSA key generation unavailable", e);
        }
    }

    private static BigInteger serial() {
        return new BigInteger(64, RANDOM).add(BigInteger.ONE);
    }

    private static String normalize(String host) {
        String value = host.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("[") && value.endsWith("]")) {
            value = value.substring(1, value.length() - 1);
        }
        if (value.isEmpty()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        return value;
    }
}
