/**
 * Interfaces for implementation of CustomFit SDK components.
 * <p>
 * Most applications will not need to refer to these types. You will use them if you are creating a
 * plugin component, such as a storage or HTTP implementation, or if you are writing tests.
 */
package ai.customfit.sdk.subsystems;
