/**
 * Main package for the CustomFit Java client SDK, containing the client and configuration classes.
 * <p>
 * You will most often use {@link ai.customfit.sdk.CFClient} (the SDK client),
 * {@link ai.customfit.sdk.CFConfig} (configuration options for the client) and
 * {@link ai.customfit.sdk.CFUser} (the user that configs are served for).
 */
package ai.customfit.sdk;
