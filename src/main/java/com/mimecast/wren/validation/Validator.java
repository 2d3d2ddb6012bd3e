package com.mimecast.wren.validation;

import com.google.common.base.Stopwatch;
import com.mimecast.wren.address.AddressParser;
import com.mimecast.wren.address.InternetAddressParser;
import com.mimecast.wren.address.ParsedAddress;
import com.mimecast.wren.domain.DomainClassifier;
import com.mimecast.wren.error.ErrorKind;
import com.mimecast.wren.error.ValidationError;
import com.mimecast.wren.error.ValidatorException;
import com.mimecast.wren.lists.ListSource;
import com.mimecast.wren.lists.UriListSource;
import com.mimecast.wren.membership.BloomMembershipIndex;
import com.mimecast.wren.membership.BloomOptions;
import com.mimecast.wren.membership.ExactMembershipIndex;
import com.mimecast.wren.membership.MembershipIndex;
import com.mimecast.wren.mx.MxRecordClient;
import com.mimecast.wren.mx.Resolution;
import com.mimecast.wren.mx.ResolutionCache;
import com.mimecast.wren.mx.XBillMxRecordClient;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Email address validator.
 *
 * <p>Runs each address through a fixed pipeline and stops at the first disqualifying condition:
 * <ol>
 *   <li>Length limit.</li>
 *   <li>Address parsing.</li>
 *   <li>Named address policy.</li>
 *   <li>Domain extraction and minimum length.</li>
 *   <li>IP literal domain.</li>
 *   <li>Reserved domain.</li>
 *   <li>Disposable domain.</li>
 *   <li>Free provider domain.</li>
 *   <li>MX resolution.</li>
 * </ol>
 *
 * <p>The membership index, free provider set and MX cache are shared by concurrent calls
 * <br>and guarded by a single read/write lock owned by this instance.
 *
 * <p>Example:
 * <pre>
 * try (Validator validator = new Validator(Options.builder().withRejectReserved(true).build())) {
 *     ValidationResult result = validator.validate("user@example.com");
 *     result.isValid(); // false
 * }
 * </pre>
 */
public class Validator implements Closeable {
    private static final Logger log = LogManager.getLogger(Validator.class);

    /**
     * Free providers always present in the free provider set.
     */
    public static final List<String> DEFAULT_FREE_PROVIDERS = List.of(
            "gmail.com",
            "yahoo.com",
            "hotmail.com",
            "outlook.com",
            "aol.com"
    );

    private final Options options;
    private final AddressParser addressParser;
    private final ListSource listSource;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ResolutionCache resolutionCache;
    private final ConcurrentDispatcher dispatcher;
    private final Set<String> freeProviders = new HashSet<>();

    private MembershipIndex membershipIndex = new ExactMembershipIndex();

    /**
     * Constructs a new Validator instance with default collaborators.
     * <p>Loads the configured lists for enabled checks.
     *
     * @param options Options instance.
     * @throws ValidatorException Unable to load a configured list.
     */
    public Validator(Options options) throws ValidatorException {
        this(new Builder(options));
    }

    /**
     * Constructs a new Validator instance from builder.
     *
     * @param builder Builder instance.
     * @throws ValidatorException Unable to load a configured list.
     */
    private Validator(Builder builder) throws ValidatorException {
        this.options = builder.options != null ? builder.options : Options.defaults();
        this.addressParser = builder.addressParser != null ? builder.addressParser : new InternetAddressParser();
        this.listSource = builder.listSource != null ? builder.listSource : new UriListSource();

        MxRecordClient mxRecordClient = builder.mxRecordClient != null
                ? builder.mxRecordClient
                : new XBillMxRecordClient(options.getDnsTimeout());
        this.resolutionCache = new ResolutionCache(mxRecordClient,
                options.getDnsTimeout(),
                options.getDnsCacheTtl(),
                options.getDnsCacheSize(),
                lock,
                builder.clock != null ? builder.clock : Clock.systemUTC());
        this.dispatcher = new ConcurrentDispatcher(options.getBatchConcurrency());

        registerFreeProviders(DEFAULT_FREE_PROVIDERS);

        try {
            loadDisposableDomains(options.getDisposableListUrl());
            loadFreeProviders(options.getFreeProvidersUrl());
        } catch (ValidatorException e) {
            resolutionCache.close();
            throw e;
        }
    }

    /**
     * Gets a new builder.
     *
     * @param options Options instance.
     * @return Builder instance.
     */
    public static Builder builder(Options options) {
        return new Builder(options);
    }

    /**
     * Validates a single address.
     * <p>Never throws, failures are reported in the result.
     *
     * @param email Address string.
     * @return ValidationResult instance.
     */
    public ValidationResult validate(String email) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        ValidationResult.Builder result = ValidationResult.builder(email);

        ValidationError error = check(email == null ? "" : email, result);

        result.withValid(error == null)
                .withError(error)
                .withValidationTime(stopwatch.stop().elapsed());

        if (error != null) {
            log.debug("Address rejected: {} - {}", email, error);
        } else {
            log.debug("Address valid: {}", email);
        }

        return result.build();
    }

    /**
     * Validates a batch of addresses concurrently.
     * <p>Results are in completion order, one per input. Correlate with {@link ValidationResult#getOriginal()}.
     *
     * @param emails Address strings.
     * @return List of ValidationResult instances.
     */
    public List<ValidationResult> validateMany(Collection<String> emails) {
        return dispatcher.dispatch(emails, this::validate);
    }

    /**
     * Registers disposable domains into the active index.
     *
     * @param domains Domains collection.
     */
    public void registerDisposableDomains(Collection<String> domains) {
        lock.writeLock().lock();
        try {
            membershipIndex.register(domains);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Registers free provider domains.
     *
     * @param domains Domains collection.
     */
    public void registerFreeProviders(Collection<String> domains) {
        if (domains == null) {
            return;
        }

        lock.writeLock().lock();
        try {
            for (String domain : domains) {
                String normalized = MembershipIndex.normalize(domain);
                if (!normalized.isEmpty()) {
                    freeProviders.add(normalized);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Loads disposable domains from URI.
     * <p>No-op when the disposable check is disabled or the URI is blank.
     *
     * @param uri List URI string.
     * @throws ValidatorException Unable to fetch or decode list.
     */
    public void loadDisposableDomains(String uri) throws ValidatorException {
        if (!options.isCheckDisposable() || StringUtils.isBlank(uri)) {
            return;
        }

        List<String> domains = listSource.fetch(uri);
        registerDisposableDomains(domains);
        log.info("Loaded {} disposable domains from: {}", domains.size(), uri);
    }

    /**
     * Loads free provider domains from URI.
     * <p>No-op when the free provider check is disabled or the URI is blank.
     *
     * @param uri List URI string.
     * @throws ValidatorException Unable to fetch or decode list.
     */
    public void loadFreeProviders(String uri) throws ValidatorException {
        if (!options.isCheckFreeProvider() || StringUtils.isBlank(uri)) {
            return;
        }

        List<String> domains = listSource.fetch(uri);
        registerFreeProviders(domains);
        log.info("Loaded {} free provider domains from: {}", domains.size(), uri);
    }

    /**
     * Switches disposable lookups to a bloom filter.
     * <p>Domains already registered and those fetched from the URI are folded into the new filter.
     * <br>One way, a validator can only be upgraded once.
     *
     * @param uri          Source list URI string.
     * @param bloomOptions BloomOptions instance.
     * @throws ValidatorException    Missing URI or unable to fetch list.
     * @throws IllegalStateException Bloom filter already active.
     */
    public void useBloomFilter(String uri, BloomOptions bloomOptions) throws ValidatorException {
        if (StringUtils.isBlank(uri)) {
            throw new ValidatorException(ErrorKind.LIST_LOAD_FAILURE, "Bloom filter source URI is required");
        }
        if (getMembershipMode() == MembershipIndex.Mode.BLOOM) {
            throw new IllegalStateException("Bloom filter already initialized");
        }

        List<String> source = listSource.fetch(uri);
        BloomOptions effective = bloomOptions != null ? bloomOptions : BloomOptions.defaults();

        lock.writeLock().lock();
        try {
            if (!(membershipIndex instanceof ExactMembershipIndex)) {
                throw new IllegalStateException("Bloom filter already initialized");
            }

            membershipIndex = BloomMembershipIndex.upgrade((ExactMembershipIndex) membershipIndex, source, effective);
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Disposable lookups switched to bloom filter from: {}", uri);
    }

    /**
     * Writes the active bloom filter to stream.
     *
     * @param out OutputStream instance.
     * @throws ValidatorException No bloom filter active.
     * @throws IOException        Unable to write.
     */
    public void saveBloomFilter(OutputStream out) throws ValidatorException, IOException {
        lock.readLock().lock();
        try {
            if (!(membershipIndex instanceof BloomMembershipIndex)) {
                throw new ValidatorException(ErrorKind.FILTER_NOT_INITIALIZED, "Bloom filter not initialized");
            }

            ((BloomMembershipIndex) membershipIndex).writeTo(out);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Replaces the active filter with one read from stream.
     * <p>An exact index switches to bloom mode with no trusted domains.
     * <br>An active bloom index keeps its trusted domains.
     * <p>Current state is untouched if the stream cannot be read.
     *
     * @param in InputStream instance.
     * @throws ValidatorException Unable to deserialize filter.
     */
    public void loadBloomFilter(InputStream in) throws ValidatorException {
        Set<String> trusted;
        lock.readLock().lock();
        try {
            trusted = membershipIndex instanceof BloomMembershipIndex
                    ? ((BloomMembershipIndex) membershipIndex).getTrustedDomains()
                    : Collections.emptySet();
        } finally {
            lock.readLock().unlock();
        }

        BloomMembershipIndex loaded;
        try {
            loaded = BloomMembershipIndex.readFrom(in, trusted);
        } catch (IOException e) {
            throw new ValidatorException(ErrorKind.FILTER_DESERIALIZE_FAILURE,
                    "Unable to read bloom filter: " + e.getMessage(), e);
        }

        lock.writeLock().lock();
        try {
            membershipIndex = loaded;
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Bloom filter loaded with {} verification attempts", loaded.getVerificationAttempts());
    }

    /**
     * Checks if domain is disposable.
     *
     * @param domain Domain string.
     * @return Boolean.
     */
    public boolean isDisposable(String domain) {
        lock.readLock().lock();
        try {
            return membershipIndex.isDisposable(domain);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Checks if domain is a free provider.
     *
     * @param domain Domain string.
     * @return Boolean.
     */
    public boolean isFreeProvider(String domain) {
        String normalized = MembershipIndex.normalize(domain);

        lock.readLock().lock();
        try {
            return freeProviders.contains(normalized);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets disposable index mode.
     *
     * @return Mode.
     */
    public MembershipIndex.Mode getMembershipMode() {
        lock.readLock().lock();
        try {
            return membershipIndex.getMode();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Gets options.
     *
     * @return Options instance.
     */
    public Options getOptions() {
        return options;
    }

    /**
     * Gets MX resolution cache.
     *
     * @return ResolutionCache instance.
     */
    ResolutionCache getResolutionCache() {
        return resolutionCache;
    }

    /**
     * Releases the DNS lookup executor.
     */
    @Override
    public void close() {
        resolutionCache.close();
    }

    /**
     * Runs the pipeline and fills in the result.
     *
     * @param email  Address string.
     * @param result Result builder.
     * @return ValidationError instance or null if valid.
     */
    private ValidationError check(String email, ValidationResult.Builder result) {
        if (utf8Length(email) > options.getMaxEmailLength()) {
            return new ValidationError(ErrorKind.LENGTH_EXCEEDED, email,
                    "email exceeds maximum length of " + options.getMaxEmailLength() + " bytes");
        }

        ParsedAddress parsed;
        try {
            parsed = addressParser.parse(email);
        } catch (ParseException e) {
            return new ValidationError(ErrorKind.PARSE_FAILURE, email, "invalid email format: " + e.getMessage());
        }
        result.withName(parsed.getName()).withAddress(parsed.getAddress());

        if (options.isRejectNamedEmails() && !parsed.getAddress().equals(email)) {
            return new ValidationError(ErrorKind.NAMED_ADDRESS_NOT_ALLOWED, email, "named emails are not allowed");
        }

        String address = parsed.getAddress();
        String domain = address.substring(address.lastIndexOf('@') + 1);

        if (utf8Length(domain) < options.getMinDomainLength()) {
            return new ValidationError(ErrorKind.DOMAIN_TOO_SHORT, domain,
                    "domain is shorter than " + options.getMinDomainLength() + " bytes");
        }

        boolean ipDomain = DomainClassifier.isIpDomain(domain);
        result.withIpDomain(ipDomain);
        if (ipDomain && options.isRejectIpDomains()) {
            return new ValidationError(ErrorKind.IP_DOMAIN_REJECTED, domain, "IP address domains are not allowed");
        }

        boolean reserved = DomainClassifier.isReserved(domain);
        result.withReserved(reserved);
        if (reserved && options.isRejectReserved()) {
            return new ValidationError(ErrorKind.RESERVED_DOMAIN_REJECTED, domain, "reserved domains are not allowed");
        }

        if (options.isCheckDisposable()) {
            boolean disposable = isDisposable(domain);
            result.withDisposable(disposable);
            if (disposable && options.isRejectDisposable()) {
                return new ValidationError(ErrorKind.DISPOSABLE_DOMAIN_REJECTED, domain,
                        "disposable domains are not allowed");
            }
        }

        if (options.isCheckFreeProvider()) {
            boolean freeProvider = isFreeProvider(domain);
            result.withFreeProvider(freeProvider);
            if (freeProvider && options.isRejectFreeProvider()) {
                return new ValidationError(ErrorKind.FREE_PROVIDER_REJECTED, domain,
                        "free email providers are not allowed");
            }
        }

        if (options.isCheckDns()) {
            Resolution resolution = resolutionCache.resolve(domain);
            if (!resolution.isFound()) {
                return resolution.getError().orElseGet(() -> new ValidationError(ErrorKind.DNS_LOOKUP_FAILURE,
                        domain, "no MX records found for " + domain));
            }
        }

        return null;
    }

    /**
     * Gets encoded length in octets, the unit of the RFC 5321 limits.
     *
     * @param value String.
     * @return UTF-8 byte count.
     */
    private static int utf8Length(String value) {
        return value.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Builder for Validator.
     * <p>Collaborators left unset get their default implementation.
     */
    public static class Builder {
        private final Options options;
        private AddressParser addressParser;
        private ListSource listSource;
        private MxRecordClient mxRecordClient;
        private Clock clock;

        /**
         * Constructs a new Builder instance.
         *
         * @param options Options instance.
         */
        public Builder(Options options) {
            this.options = options;
        }

        public Builder withAddressParser(AddressParser addressParser) {
            this.addressParser = addressParser;
            return this;
        }

        public Builder withListSource(ListSource listSource) {
            this.listSource = listSource;
            return this;
        }

        public Builder withMxRecordClient(MxRecordClient mxRecordClient) {
            this.mxRecordClient = mxRecordClient;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the Validator instance.
         *
         * @return Validator instance.
         * @throws ValidatorException Unable to load a configured list.
         */
        public Validator build() throws ValidatorException {
            return new Validator(this);
        }
    }
}
