/**
 * Disposable domain membership.
 *
 * <p>Two interchangeable representations behind {@link com.mimecast.wren.membership.MembershipIndex}:
 * <ul>
 *   <li>{@link com.mimecast.wren.membership.ExactMembershipIndex} - plain set, no false positives.</li>
 *   <li>{@link com.mimecast.wren.membership.BloomMembershipIndex} - Guava bloom filter with trusted overrides.</li>
 * </ul>
 *
 * <p>An index starts exact and may be upgraded once to a bloom filter. There is no way back.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ExactMembershipIndex exact = new ExactMembershipIndex(List.of("mailinator.com"));
 * BloomOptions options = BloomOptions.builder()
 *         .withFalsePositiveRate(0.001)
 *         .withVerificationAttempts(2)
 *         .withTrustedDomains(Set.of("gmail.com"))
 *         .build();
 * MembershipIndex bloom = BloomMembershipIndex.upgrade(exact, sourceDomains, options);
 * bloom.isDisposable("mailinator.com"); // true
 * }</pre>
 */
package com.mimecast.wren.membership;
