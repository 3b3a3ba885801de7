package com.fightsync.domain.model;

/**
 * A validated fight-card entry. Boxed fields are null when the source did not
 * supply them, so an upsert can leave the stored value alone.
 */
public class ScrapedFight {

    private String id;

    private String fighter1Id;

    private String fighter2Id;

    private String fighter1Name;

    private String fighter2Name;

    private String weightClass;

    private Boolean titleFight;

    private Boolean mainEvent;

    private String cardPosition;

    private Integer scheduledRounds;

    private Integer fightNumber;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
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

    public String getWeightClass() {
        return weightClass;
    }

    public void setWeightClass(String weightClass) {
        this.weightClass = weightClass;
    }

    public Boolean getTitleFight() {
        return titleFight;
    }

    public void setTitleFight(Boolean titleFight) {
        this.titleFight = titleFight;
    }

    public Boolean getMainEvent() {
        return mainEvent;
    }

    public void setMainEvent(Boolean mainEvent) {
        this.mainEvent = mainEvent;
    }

    public String getCardPosition() {
        return cardPosition;
    }

    public void setCardPosition(String cardPosition) {
        this.cardPosition = cardPosition;
    }

    public Integer getScheduledRounds() {
        return scheduledRounds;
    }

    public void setScheduledRounds(Integer scheduledRounds) {
        this.scheduledRounds = scheduledRounds;
    }

    public Integer getFightNumber() {
        return fightNumber;
    }

    public void setFightNumber(Integer fightNumber) {
        this.fightNumber = fightNumber;
    }
}
