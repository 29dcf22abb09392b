package tw.gc.daytrade.picker.entities;

public record FollowerPick(SectorMember member, double score) {

    public String stockId() {
        return member.stockId();
    }

    public String sectorId() {
        return member.sectorId();
    }
}
