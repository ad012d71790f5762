package com.ai.clinicbot.component;

import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class BotMessages {

    public static final List<String> MAIN_MENU_OPTIONS = List.of(
            "Agendar cita",
            "Reagendar o cancelar cita",
            "Preguntas frecuentes (FAQs)",
            "Hablar con secretaría"
    );

    public String defaultGreeting() {
        return "¡Hola! Soy el asistente virtual. ¿En qué puedo ayudarte?";
    }

    public String menuRetry() {
        return "No entendí tu respuesta. Por favor selecciona una opción:";
    }

    public String menuReturn() {
        return "¿En qué más puedo ayudarte?";
    }

    public String invalidOption() {
        return "Opción inválida. Por favor selecciona un número de la lista:";
    }

    public String handoff() {
        return "Te estoy conectando con nuestra secretaría. En breve recibirás respuesta. 📞";
    }

    // Booking

    public String noDoctors() {
        return "No hay doctores disponibles para agendar. Te conecto con la secretaría.";
    }

    public String chooseDoctor() {
        return "¿Con qué doctor deseas agendar?";
    }

    public String noAvailability() {
        return "No hay disponibilidad en las próximas 2 semanas. Te conecto con la secretaría para agendar en fechas futuras.";
    }

    public String chooseWeek(String doctorName) {
        return "Selecciona la semana para tu cita con " + doctorName + ":";
    }

    public String chooseDay() {
        return "¿Qué día prefieres?";
    }

    public String chooseHour(String dayLabel) {
        return "Horarios disponibles para el " + dayLabel + ":";
    }

    public String moreHoursOption() {
        return "Ver más horarios";
    }

    public String confirmBooking(String doctorName, String dateTime) {
        return "Vas a agendar una cita con " + doctorName + " el " + dateTime + ". ¿Confirmas?";
    }

    public String confirmReschedule(String doctorName, String dateTime) {
        return "Tu cita con " + doctorName + " se moverá al " + dateTime + ". ¿Confirmas?";
    }

    public List<String> confirmOptions() {
        return List.of("Confirmar", "Cambiar horario", "Cancelar");
    }

    public String askName() {
        return "Para completar tu cita, ¿cuál es tu nombre completo?";
    }

    public String askNameAgain() {
        return "Por favor escribe tu nombre completo para registrar la cita.";
    }

    public String slotTaken() {
        return "Ese horario acaba de ser ocupado. Estos son los horarios disponibles:";
    }

    public String bookingConfirmed(String doctorName, String dateTime) {
        return "¡Listo! Tu cita con " + doctorName + " quedó agendada para el " + dateTime + ". Te enviaremos un recordatorio.";
    }

    public String rescheduleConfirmed(String doctorName, String dateTime) {
        return "¡Listo! Tu cita con " + doctorName + " fue reagendada para el " + dateTime + ".";
    }

    public String bookingAborted() {
        return "No se agendó ninguna cita. ¿En qué más puedo ayudarte?";
    }

    public String bookingFailed() {
        return "No pude completar la cita en este momento. Te conecto con la secretaría.";
    }

    // Reschedule / cancel

    public String patientNotFound() {
        return "No encontré tu información en el sistema. Por favor contacta a la secretaría.";
    }

    public String noUpcomingAppointments() {
        return "No tienes citas programadas para reagendar o cancelar.";
    }

    public String chooseAppointment() {
        return "¿Cuál de tus citas deseas modificar?";
    }

    public String appointmentAction(String summary) {
        return "Tu cita: " + summary + ". ¿Qué deseas hacer?";
    }

    public List<String> appointmentActionOptions() {
        return List.of("Reagendar", "Cancelar cita", "Volver al menú");
    }

    public String confirmCancel(String summary) {
        return "¿Seguro que deseas cancelar tu cita del " + summary + "?";
    }

    public List<String> confirmCancelOptions() {
        return List.of("Sí, cancelar", "No, mantener mi cita");
    }

    public String cancelConfirmed() {
        return "Tu cita fue cancelada. Si deseas agendar otra, escribe 0 para volver al inicio.";
    }

    public String cancelKept() {
        return "Perfecto, tu cita se mantiene. ¿En qué más puedo ayudarte?";
    }

    // FAQ

    public String askFaq() {
        return "¿Qué te gustaría saber? Escribe tu pregunta y buscaré la respuesta.";
    }

    public String faqAnswer(String question, String answer) {
        return "*" + question + "*\n\n" + answer + "\n\n¿Necesitas algo más?";
    }

    public List<String> faqAnswerOptions() {
        return List.of("Volver al menú principal", "Otra pregunta");
    }

    public String faqNotFound() {
        return "No encontré una respuesta para esa pregunta. ¿Te gustaría hablar con la secretaría?";
    }

    public List<String> faqNotFoundOptions() {
        return List.of("Sí, contactar secretaría", "No, volver al menú");
    }

    public String faqNextQuestion() {
        return "Escribe tu siguiente pregunta:";
    }

    public String genericError() {
        return "Tuvimos un problema procesando tu mensaje. Te conecto con la secretaría.";
    }

    // Staff

    public String staffHandoffNotice(String patientPhone) {
        return "El paciente " + patientPhone + " solicitó hablar con secretaría por WhatsApp.";
    }
}
