package com.firesim.core.model;

/**
 * Weather and fire-behaviour parameters supplied by the trainer.
 *
 * @param fireDangerRating AFDRS rating (noRating, moderate, high, extreme, catastrophic)
 * @param windSpeed        km/h
 * @param windDirection    compass label the wind blows from: N, NE, E, SE, S, SW, W, NW
 * @param temperature      degrees Celsius
 * @param humidity         relative humidity percentage
 * @param timeOfDay        dawn, morning, midday, afternoon, dusk or night
 * @param intensity        low, moderate, high, veryHigh, extreme or catastrophic
 * @param fireStage        spotFire, developing, established or major
 * @param flameHeightM     explicit flame height in metres; nullable
 * @param rateOfSpreadKmh  explicit rate of spread in km/h; nullable
 */
public record ScenarioInputs(
    String fireDangerRating,
    double windSpeed,
    String windDirection,
    double temperature,
    double humidity,
    String timeOfDay,
    String intensity,
    String fireStage,
    Double flameHeightM,
    Double rateOfSpreadKmh
) {

    public ScenarioInputs(String fireDangerRating, double windSpeed, String windDirection,
                          double temperature, double humidity, String timeOfDay,
                          String intensity, String fireStage) {
        this(fireDangerRating, windSpeed, windDirection, temperature, humidity,
                timeOfDay, intensity, fireStage, null, null);
    }
}
