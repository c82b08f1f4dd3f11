package com.cardiorisk.scoring;

/**
 * Advice lines with a stable key for translation and the default English
 * text.
 */
public enum Recommendation {

    // Category headlines
    HEADLINE_LOW("risk.low.headline",
        "Your risk level is low. Keep up the good work and continue to maintain a healthy lifestyle."),
    HEADLINE_MILD("risk.mild.headline",
        "Your risk level is mild. A few lifestyle changes can lower it further."),
    HEADLINE_MODERATE("risk.moderate.headline",
        "Your risk level is moderate. Here are some recommendations to reduce your risk:"),
    HEADLINE_HIGH("risk.high.headline",
        "Your risk level is high. Here are some recommendations to reduce your risk:"),
    HEADLINE_CRITICAL("risk.critical.headline",
        "Your risk level is very high. Seek emergency care now."),

    // Category-level advice
    MONITOR_SYMPTOMS("general.monitor",
        "Monitor your symptoms and seek care if they change, return or worsen."),
    HEART_HEALTHY_DIET("general.diet",
        "Diet: Follow a heart-healthy diet rich in fruits, vegetables, whole grains, lean proteins and healthy fats. Limit processed foods, sodium and saturated fats."),
    REGULAR_EXERCISE("general.exercise",
        "Exercise: Aim for at least 150 minutes per week of moderate-intensity activity. Start slowly and increase gradually."),
    WEIGHT_MANAGEMENT("general.weight",
        "Weight management: Maintain a healthy weight through balanced diet and regular exercise."),
    REGULAR_CHECKUPS("general.checkups",
        "Regular checkups: Schedule regular checkups with your primary care doctor. Early detection of health issues is crucial."),
    MEDICATION_ADHERENCE("general.medication",
        "Medication adherence: Take prescribed medications exactly as directed. Do not stop or change them without consulting your doctor."),
    BOOK_CONSULTATION("care.consult",
        "Book a clinic visit or teleconsultation within the next 48 hours."),
    URGENT_ASSESSMENT("care.urgent",
        "Arrange an urgent clinic or emergency department assessment within 6 to 24 hours."),
    AVOID_EXERTION("care.rest",
        "Avoid strenuous activity until you have been assessed by a doctor."),
    CALL_EMERGENCY("care.emergency",
        "Call your local emergency number or go to the nearest emergency room immediately."),
    DO_NOT_DRIVE("care.noDriving",
        "Do not drive yourself. Ask someone to take you or call an ambulance."),

    // Vital signs
    BLOOD_PRESSURE_CRITICAL("vitals.bp.critical",
        "Blood pressure: Your blood pressure is critically high. Seek immediate medical attention and avoid activities that could raise it further."),
    BLOOD_PRESSURE_ELEVATED("vitals.bp.elevated",
        "Blood pressure: Your blood pressure reading is elevated. Monitor it regularly and discuss management with your doctor."),
    BLOOD_PRESSURE_LOW("vitals.bp.low",
        "Blood pressure: Your blood pressure is low. Sit or lie down if you feel faint and contact your doctor."),
    HEART_RATE_HIGH("vitals.hr.high",
        "Heart rate: Your heart rate is elevated. Avoid caffeine and stimulants, and consult your doctor if a rapid heart rate persists."),
    HEART_RATE_LOW("vitals.hr.low",
        "Heart rate: Your heart rate is low. Watch for dizziness or fainting and consult your doctor if they occur."),
    OXYGEN_LOW("vitals.spo2.low",
        "Oxygen levels: Your oxygen saturation is below normal. Seek medical attention as this may indicate a serious respiratory or cardiac condition."),
    FEVER("vitals.temperature.fever",
        "Temperature: You have a fever, which may indicate infection. Rest, stay hydrated and consult your doctor if it persists."),

    // Risk factors
    RISK_HYPERTENSION("riskFactor.hypertension",
        "High blood pressure: Follow your treatment plan, monitor your blood pressure regularly and keep to a low-sodium diet."),
    RISK_DIABETES("riskFactor.diabetes",
        "Diabetes: Manage your diabetes through diet, exercise and medication as prescribed. Monitor blood sugar regularly."),
    RISK_CHRONIC_KIDNEY_DISEASE("riskFactor.ckd",
        "Kidney disease: Keep regular follow-up with your kidney specialist, as kidney disease raises cardiovascular risk."),
    RISK_HIGH_CHOLESTEROL("riskFactor.cholesterol",
        "High cholesterol: Eat a diet low in saturated fats, exercise regularly and take cholesterol medication as prescribed."),
    RISK_SMOKING("riskFactor.smoking",
        "Smoking: Quitting smoking significantly reduces your risk of heart disease. Ask your doctor about cessation programs."),
    RISK_OBESITY("riskFactor.obesity",
        "Weight: Work with your doctor on a safe weight-loss plan to reduce strain on your heart."),
    RISK_FAMILY_HISTORY("riskFactor.familyHistory",
        "Family history: Tell your doctor about heart disease in your family so screening can start early."),
    RISK_PREVIOUS_HEART_DISEASE("riskFactor.previousHeartDisease",
        "Heart disease history: Visit your cardiologist regularly, take prescribed medications and report any new or worsening symptoms.");

    private final String key;
    private final String text;

    Recommendation(String key, String text) {
        this.key = key;
        this.text = text;
    }

    public String key() {
        return key;
    }

    public String text() {
        return text;
    }

    public static Recommendation forRiskFactor(RiskFactor factor) {
        return switch (factor) {
            case HYPERTENSION -> RISK_HYPERTENSION;
            case DIABETES -> RISK_DIABETES;
            case CHRONIC_KIDNEY_DISEASE -> RISK_CHRONIC_KIDNEY_DISEASE;
            case HIGH_CHOLESTEROL -> RISK_HIGH_CHOLESTEROL;
            case SMOKING -> RISK_SMOKING;
            case OBESITY -> RISK_OBESITY;
            case FAMILY_HISTORY -> RISK_FAMILY_HISTORY;
            case PREVIOUS_HEART_DISEASE -> RISK_PREVIOUS_HEART_DISEASE;
        };
    }
}
