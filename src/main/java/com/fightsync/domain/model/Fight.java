package com.fightsync.domain.model;

/**
 * A bout on a card.
 *
 * Scheduling fields are owned by the reconciler. Prediction fields
 * (funFactor through predictedFunScore) are written by the external scoring
 * job and must survive a fight-card upsert untouched.
 */
public class Fight {

    private String id;

    private String eventId;

    private String fighter1Id;

    private String fighter2Id;

    private String fighter1Name;

    private String fighter2Name;

    /** Unordered normalized fighter-pair key, unique within the event. */
    private String pairKey;

    private String weightClass;

    private boolean titleFight;

    private boolean mainEvent;

    private String cardPosition;

    private int scheduledRounds;

    private Integer fightNumber;

    // Prediction fields

    private int funFactor;

    private int finishProbability;

    private String entertainmentReason;

    private String aiDescription;

    private String fightPrediction;

    private String riskLevel;

    private double predictedFunScore;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getFighter1Id() {
        return fighter1Id;
    }

    public void setFighter1Id(String fighter1Id) {
        this.fighter1Id = fighter1Id;
    }

    public String getFighter2Id() {
        return fighter2Id;
    }

    public void setFighter2Id(String fighter2Id) {
        this.fighter2Id = fighter2Id;
    }

    public String getFighter1Name() {
        return fighter1Name;
    }

    public void setFighter1Name(String fighter1Name) {
        this.fighter1Name = fighter1Name;
    }

    public String getFighter2Name() {
        return fighter2Name;
    }

    public void setFighter2Name(String fighter2Name) {
        this.fighter2Name = fighter2Name;
    }

    public String getPairKey() {
        return pairKey;
    }

    public void setPairKey(String pairKey) {
        this.pairKey = pairKey;
    }

    public String getWeightClass() {
        return weightClass;
    }

    public void setWeightClass(String weightClass) {
        this.weightClass = weightClass;
    }

    public boolean isTitleFight() {
        return titleFight;
    }

    public void setTitleFight(boolean titleFight) {
        this.titleFight = titleFight;
    }

    public boolean isMainEvent() {
        return mainEvent;
    }

    public void setMainEvent(boolean mainEvent) {
        this.mainEvent = mainEvent;
    }

    public String getCardPosition() {
        return cardPosition;
    }

    public void setCardPosition(String cardPosition) {
        this.cardPosition = cardPosition;
    }

    public int getScheduledRounds() {
        return scheduledRounds;
    }

    public void setScheduledRounds(int scheduledRounds) {
        this.scheduledRounds = scheduledRounds;
    }

    public Integer getFightNumber() {
        return fightNumber;
    }

    public void setFightNumber(Integer fightNumber) {
        this.fightNumber = fightNumber;
    }

    public int getFunFactor() {
        return funFactor;
    }

    public void setFunFactor(int funFactor) {
        this.funFactor = funFactor;
    }

    public int getFinishProbability() {
        return finishProbability;
    }

    public void setFinishProbability(int finishProbability) {
        this.finishProbability = finishProbability;
    }

    public String getEntertainmentReason() {
        return entertainmentReason;
    }

    public void setEntertainmentReason(String entertainmentReason) {
        this.entertainmentReason = entertainmentReason;
    }

    public String getAiDescription() {
        return aiDescription;
    }

    public void setAiDescription(String aiDescription) {
        this.aiDescription = aiDescription;
    }

    public String getFightPrediction() {
        return fightPrediction;
    }

    public void setFightPrediction(String fightPrediction) {
        this.fightPrediction = fightPrediction;
    }

    public String getRiskLevel() {
        return riskLevel;
    }

    public void setRiskLevel(String riskLevel) {
        this.riskLevel = riskLevel;
    }

    public double getPredictedFunScore() {
        return predictedFunScore;
    }

    public void setPredictedFunScore(double predictedFunScore) {
        this.predictedFunScore = predictedFunScore;
    }

    public String label() {
        return fighter1Name + " vs " + fighter2Name;
    }
}
