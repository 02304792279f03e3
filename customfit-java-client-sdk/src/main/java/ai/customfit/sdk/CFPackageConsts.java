package ai.customfit.sdk;

final class CFPackageConsts {
    static final String SDK_NAME = "customfit-java-client-sdk";
    static final String SDK_CLIENT_NAME = "CustomFitJavaClient";
    static final String SDK_VERSION = "1.1.1";

    private CFPackageConsts() {
    }
}
