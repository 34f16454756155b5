package com.claimrunner.shared.config;

public record RemoteConfig(
    String bridgeUrl,
    int apiId,
    String apiHash,
    String botUsername,
    String bonusLabel,
    String subscriptionLabel,
    long settleSeconds,
    int messageLimit
) {
    public static RemoteConfig defaults() {
        return new RemoteConfig("http://localhost:8081", 0, "", "@CatStarssRobot",
                "Бонус", "Я подписался", 5, 5);
    }

    @Override
    public String toString() {
        return "RemoteConfig[bridgeUrl=" + bridgeUrl + ", apiId=" + apiId + ", botUsername=" + botUsername + "]";
    }
}
