package com.fightsync.domain.model;

/**
 * Fighter identity and record. Upserted by id, never deleted by the reconciler.
 */
public class Fighter {

    private String id;

    private String name;

    private String nickname;

    private int wins;

    private int losses;

    private int draws;

    private String weightClass;

    /** Record as displayed by the source, e.g. "27-1-0". */
    private String record;

    public Fighter() {
    }

    public Fighter(String id, String name, String weightClass) {
        this.id = id;
        this.name = name;
        this.weightClass = weightClass;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getNickname() {
        return nickname;
    }

    public void setNickname(String nickname) {
        this.nickname = nickname;
    }

    public int getWins() {
        return wins;
    }

    public void setWins(int wins) {
        this.wins = wins;
    }

    public int getLosses() {
        return losses;
    }

    public void setLosses(int losses) {
        this.losses = losses;
    }

    public int getDraws() {
        return draws;
    }

    public void setDraws(int draws) {
        this.draws = draws;
    }

    public String getWeightClass() {
        return weightClass;
    }

    public void setWeightClass(String weightClass) {
        this.weightClass = weightClass;
    }

    public String getRecord() {
        return record;
    }

    public void setRecord(String record) {
        this.record = record;
    }
}
