package com.advocacypacket.service.ingest;

import com.advocacypacket.core.model.Delegation;
import com.advocacypacket.core.model.DelegationMember;
import com.advocacypacket.core.model.DistrictOverlap;
import com.advocacypacket.core.model.MemberRole;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

public class DelegationNormalizer {
    public Delegation normalize(JsonNode document) {
        JsonNode root = unwrap(document);
        if (root == null) {
            return Delegation.empty();
        }
        return new Delegation(
                members(root.get("senators"), MemberRole.SENATOR),
                members(root.get("representatives"), MemberRole.REPRESENTATIVE)
        );
    }

    public List<DistrictOverlap> districts(JsonNode document) {
        JsonNode root = unwrap(document);
        if (root == null) {
            return List.of();
        }
        List<DistrictOverlap> districts = new ArrayList<>();
        for (JsonNode district : JsonFields.elements(root.get("districts"))) {
            if (!district.isObject()) {
                continue;
            }
            districts.add(new DistrictOverlap(
                    JsonFields.text(district, "district"),
                    JsonFields.number(district.get("overlap_pct"))
            ));
        }
        return districts;
    }

    private static JsonNode unwrap(JsonNode document) {
        if (document == null || !document.isObject()) {
            return null;
        }
        JsonNode nested = document.get("delegation");
        return nested != null && nested.isObject() ? nested : document;
    }

    private static List<DelegationMember> members(JsonNode array, MemberRole role) {
        List<DelegationMember> members = new ArrayList<>();
        for (JsonNode member : JsonFields.elements(array)) {
            if (!member.isObject()) {
                continue;
            }
            members.add(new DelegationMember(
                    JsonFields.text(member, "bioguide_id"),
                    JsonFields.text(member, "formatted_name", "name"),
                    role,
                    JsonFields.text(member, "state"),
                    committees(member.get("committees"))
            ));
        }
        return members;
    }

    private static List<String> committees(JsonNode array) {
        List<String> names = new ArrayList<>();
        for (JsonNode committee : JsonFields.elements(array)) {
            String name = committee.isTextual()
                    ? committee.textValue().trim()
                    : JsonFields.text(committee, "committee_name", "committee_id");
            if (name != null && !name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }
}
