package com.loci.server.ai.prompt;

import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;

/**
 * 各生成任务的提示词模板。所有模板都要求模型只返回 JSON。
 */
public final class PromptTemplates {

    private static final String POI_ITEM_SCHEMA = "        {\n"
            + "            \"name\": \"POI Name\",\n"
            + "            \"latitude\": <float>,\n"
            + "            \"longitude\": <float>,\n"
            + "            \"category\": \"Category (e.g., Museum, Historical Site)\",\n"
            + "            \"description_poi\": \"\",\n"
            + "            \"address\": \"\",\n"
            + "            \"website\": \"\",\n"
            + "            \"opening_hours\": \"Opening hours as string (e.g., 'Mon-Fri 9:00-17:00, Sat 10:00-15:00')\"\n"
            + "        }\n";

    private PromptTemplates() {
    }

    public static String cityData(String cityName) {
        return "You are a travel assistant. Provide general information about " + cityName + ".\n"
                + "Respond with JSON:\n"
                + "{\n"
                + "    \"city\": \"" + cityName + "\",\n"
                + "    \"country\": \"Country name\",\n"
                + "    \"state_province\": \"State/Province if applicable\",\n"
                + "    \"description\": \"Detailed city description (100-150 words)\",\n"
                + "    \"center_latitude\": <float>,\n"
                + "    \"center_longitude\": <float>,\n"
                + "    \"population\": \"\",\n"
                + "    \"area\": \"\",\n"
                + "    \"timezone\": \"\",\n"
                + "    \"language\": \"\",\n"
                + "    \"weather\": \"\",\n"
                + "    \"attractions\": \"\",\n"
                + "    \"history\": \"\"\n"
                + "}";
    }

    public static String generalPois(String cityName) {
        return "You are a travel assistant. List general points of interest in " + cityName + ".\n"
                + "Respond with JSON:\n"
                + "{\n"
                + "    \"points_of_interest\": [\n"
                + POI_ITEM_SCHEMA
                + "    ]\n"
                + "}";
    }

    /**
     * 个性化行程：兴趣、标签与自由文本偏好拼进 USER PREFERENCES。
     */
    public static String personalizedItinerary(String cityName, List<String> interests, List<String> tags,
                                               String preferences) {
        StringBuilder prefs = new StringBuilder();
        if (interests != null && !interests.isEmpty()) {
            prefs.append("- Interests: ").append(String.join(", ", interests)).append("\n");
        }
        if (tags != null && !tags.isEmpty()) {
            prefs.append("- Tags: ").append(String.join(", ", tags)).append("\n");
        }
        if (StringUtils.hasText(preferences)) {
            prefs.append("- Other: ").append(preferences.trim()).append("\n");
        }
        if (prefs.length() == 0) {
            prefs.append("- No specific preferences, suggest a balanced mix.\n");
        }
        return "You are a travel planning assistant. Create a personalized itinerary for " + cityName
                + " based on user preferences.\n"
                + "USER PREFERENCES:\n"
                + prefs
                + "Respond with JSON:\n"
                + "{\n"
                + "    \"itinerary_name\": \"Creative itinerary name\",\n"
                + "    \"overall_description\": \"Detailed description (100-150 words)\",\n"
                + "    \"points_of_interest\": [\n"
                + POI_ITEM_SCHEMA
                + "    ]\n"
                + "}";
    }

    public static String accommodation(String cityName, Double lat, Double lon, String preferences) {
        return domainPrompt("You are a hotel recommendation assistant. Find a max of 5 suitable accommodation in ",
                "hotels", "Hotel|Hostel|Guesthouse|Apartment", cityName, lat, lon, preferences);
    }

    public static String dining(String cityName, Double lat, Double lon, String preferences) {
        return domainPrompt("You are a restaurant recommendation assistant. Find a max of 5 dining options in ",
                "restaurants", "Fine Dining|Casual Dining|Fast Food|Cafe|Bar", cityName, lat, lon, preferences);
    }

    public static String activities(String cityName, Double lat, Double lon, String preferences) {
        return domainPrompt("You are an activity recommendation assistant. Find a max of 5 activities in ",
                "activities", "Museum|Outdoor Activity|Entertainment|Cultural|Sports", cityName, lat, lon, preferences);
    }

    private static String domainPrompt(String intro, String arrayName, String categories, String cityName,
                                       Double lat, Double lon, String preferences) {
        StringBuilder sb = new StringBuilder(intro).append(cityName);
        if (lat != null && lon != null) {
            sb.append(String.format(Locale.ROOT, " near coordinates %.4f, %.4f", lat, lon));
        }
        sb.append(".\n");
        if (StringUtils.hasText(preferences)) {
            sb.append("USER PREFERENCES:\n").append(preferences.trim()).append("\n");
        }
        sb.append("Respond with JSON:\n")
                .append("{\n")
                .append("    \"").append(arrayName).append("\": [\n")
                .append("        {\n")
                .append("            \"city\": \"").append(cityName).append("\",\n")
                .append("            \"name\": \"Name\",\n")
                .append("            \"latitude\": <float>,\n")
                .append("            \"longitude\": <float>,\n")
                .append("            \"category\": \"").append(categories).append("\",\n")
                .append("            \"description\": \"Description matching preferences\",\n")
                .append("            \"address\": \"\",\n")
                .append("            \"website\": \"\",\n")
                .append("            \"opening_hours\": \"Opening hours as string\",\n")
                .append("            \"price_range\": \"\",\n")
                .append("            \"rating\": 0,\n")
                .append("            \"tags\": [],\n")
                .append("            \"distance\": <float>\n")
                .append("        }\n")
                .append("    ]\n")
                .append("}");
        return sb.toString();
    }
}
